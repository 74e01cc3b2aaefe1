/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.cimrepo.api;

import static java.lang.String.format;

import org.jetbrains.annotations.NotNull;

/**
 * Main exception thrown by repository operations. It carries the
 * {@link CIMStatus} a WBEM server would report for the failure, so that a
 * protocol layer can map it onto its error response unchanged.
 */
public class CIMException extends Exception {

    private static final long serialVersionUID = 6120407431385720211L;

    private final CIMStatus status;

    private final String detail;

    public CIMException(@NotNull CIMStatus status, String message, Throwable cause) {
        super(format("%s (%d): %s", status.getName(), status.getCode(), message), cause);
        this.status = status;
        this.detail = message;
    }

    public CIMException(@NotNull CIMStatus status, String message) {
        this(status, message, null);
    }

    public boolean isOfStatus(CIMStatus status) {
        return this.status == status;
    }

    @NotNull
    public CIMStatus getStatus() {
        return status;
    }

    public int getCode() {
        return status.getCode();
    }

    /**
     * @return the message without the status prefix
     */
    public String getDetail() {
        return detail;
    }
}
