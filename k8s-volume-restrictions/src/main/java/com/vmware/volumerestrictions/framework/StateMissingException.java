/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions.framework;

/**
 * Thrown when a plugin reads state that PreFilter should have written for the current attempt.
 */
public class StateMissingException extends RuntimeException {
    public StateMissingException(final String message) {
        super(message);
    }
}
