/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions.framework;

import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * The outcome of invoking a plugin at one of the extension points. A null-free replacement for
 * "no error": successful results are represented by {@link #success()}.
 */
public final class Status {
    private static final Status SUCCESS = new Status(Code.SUCCESS, ImmutableList.of(), null);
    private static final Status SKIP = new Status(Code.SKIP, ImmutableList.of(), null);

    public enum Code {
        SUCCESS,
        /*
         * The pod does not fit the node, but preemption or a change in the cluster might help.
         */
        UNSCHEDULABLE,
        /*
         * The pod does not fit, and preemption will not help. Only a cluster event can change that.
         */
        UNSCHEDULABLE_AND_UNRESOLVABLE,
        ERROR,
        /*
         * Returned by PreFilter when the plugin has nothing to check for this pod. The framework
         * does not invoke the plugin's Filter for the rest of the scheduling attempt.
         */
        SKIP
    }

    private final Code code;
    private final List<String> reasons;
    @Nullable private final Throwable error;

    private Status(final Code code, final List<String> reasons, @Nullable final Throwable error) {
        this.code = code;
        this.reasons = reasons;
        this.error = error;
    }

    public static Status success() {
        return SUCCESS;
    }

    public static Status skip() {
        return SKIP;
    }

    public static Status unschedulable(final String reason) {
        return new Status(Code.UNSCHEDULABLE, ImmutableList.of(reason), null);
    }

    public static Status unschedulableAndUnresolvable(final String reason) {
        return new Status(Code.UNSCHEDULABLE_AND_UNRESOLVABLE, ImmutableList.of(reason), null);
    }

    public static Status asStatus(final Throwable error) {
        final String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return new Status(Code.ERROR, ImmutableList.of(message), error);
    }

    public Code code() {
        return code;
    }

    public List<String> reasons() {
        return reasons;
    }

    @Nullable
    public Throwable error() {
        return error;
    }

    public boolean isSuccess() {
        return code == Code.SUCCESS;
    }

    public boolean isSkip() {
        return code == Code.SKIP;
    }

    public boolean isRejected() {
        return code == Code.UNSCHEDULABLE || code == Code.UNSCHEDULABLE_AND_UNRESOLVABLE;
    }

    public String message() {
        return String.join(", ", reasons);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Status)) {
            return false;
        }
        final Status status = (Status) o;
        return code == status.code && reasons.equals(status.reasons);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, reasons);
    }

    @Override
    public String toString() {
        return "Status{" +
                "code=" + code.name() +
                ", reasons=" + reasons +
                '}';
    }
}
