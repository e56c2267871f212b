/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions;

/**
 * A claim store failed to answer a lookup.
 */
public class ClaimLookupException extends RuntimeException {
    public ClaimLookupException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ClaimLookupException(final String message) {
        super(message);
    }
}
