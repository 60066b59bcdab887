/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.model;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Outcome of normalizing a raw address: either an accepted canonical address or a rejection with a reason.
 */
public sealed interface NormalizationResult {

    boolean isAccepted();

    /**
     * Gets the normalized address, throws if rejected.
     */
    NormalizedAddress getAddress();

    /**
     * Gets the rejection reason, throws if accepted.
     */
    RejectionReason getReason();

    NormalizationResult onAccepted(Consumer<NormalizedAddress> consumer);

    NormalizationResult onRejected(Consumer<Rejected> consumer);

    static NormalizationResult accepted(NormalizedAddress address) {
        return new Accepted(address);
    }

    static NormalizationResult rejected(RejectionReason reason, String detail) {
        return new Rejected(reason, detail);
    }

    record Accepted(NormalizedAddress address) implements NormalizationResult {
        public Accepted {
            Objects.requireNonNull(address, "address must not be null");
        }

        @Override
        public boolean isAccepted() {
            return true;
        }

        @Override
        public NormalizedAddress getAddress() {
            return address;
        }

        @Override
        public RejectionReason getReason() {
            throw new IllegalStateException("Cannot get rejection reason from accepted result");
        }

        @Override
        public NormalizationResult onAccepted(Consumer<NormalizedAddress> consumer) {
            consumer.accept(address);
            return this;
        }

        @Override
        public NormalizationResult onRejected(Consumer<Rejected> consumer) {
            return this;
        }
    }

    record Rejected(RejectionReason reason, String detail) implements NormalizationResult {
        public Rejected {
            Objects.requireNonNull(reason, "reason must not be null");
            detail = detail == null ? "" : detail;
        }

        @Override
        public boolean isAccepted() {
            return false;
        }

        @Override
        public NormalizedAddress getAddress() {
            throw new IllegalStateException("Cannot get address from rejected result: " + reason.code());
        }

        @Override
        public RejectionReason getReason() {
            return reason;
        }

        @Override
        public NormalizationResult onAccepted(Consumer<NormalizedAddress> consumer) {
            return this;
        }

        @Override
        public NormalizationResult onRejected(Consumer<Rejected> consumer) {
            consumer.accept(this);
            return this;
        }
    }
}
