/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions;

/**
 * A queueing hint received objects it was not registered for.
 */
public class UnexpectedEventPayloadException extends RuntimeException {
    public UnexpectedEventPayloadException(final String message) {
        super(message);
    }
}
