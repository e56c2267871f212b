/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions;

/**
 * A pod references a claim that does not exist (yet).
 */
public class ClaimNotFoundException extends ClaimLookupException {
    private final String namespace;
    private final String claimName;

    public ClaimNotFoundException(final String namespace, final String claimName) {
        super(String.format("persistentvolumeclaim \"%s\" not found in namespace \"%s\"", claimName, namespace));
        this.namespace = namespace;
        this.claimName = claimName;
    }

    public String namespace() {
        return namespace;
    }

    public String claimName() {
        return claimName;
    }
}
