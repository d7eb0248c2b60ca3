/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator.allocator;

import java.util.Optional;

/**
 * Decides whether a peer's pod range has to be remapped, and reserves address space so that no two
 * peers are ever given overlapping ranges.
 * <p>
 * Implementations are safe for concurrent use: every call is serialized against a single reservation
 * table, so a decision is always taken against a consistent snapshot. Decisions are deterministic and
 * idempotent: resolving the same range for the same cluster again, with no release in between, gives
 * the same answer.
 */
public interface SubnetAllocator {

    /**
     * Resolves a peer's advertised pod range against the current reservations.
     *
     * @param candidate the range the peer advertised
     * @param clusterId the peer's cluster identifier, the key of its reservation
     * @return empty if the peer can keep its range, otherwise the reserved replacement, which has the
     * same size as the candidate
     * @throws SubnetExhaustedException if a replacement is needed but none is free
     */
    Optional<Cidr> resolve(Cidr candidate, String clusterId);

    /**
     * Records a decision taken before this allocator existed, typically by an earlier run of the
     * operator, so that its range is not handed out to another peer. Restoring a cluster's current
     * reservation again is a no-op.
     *
     * @param range the range the peer's pods occupy here, either its own or the replacement it was given
     * @param clusterId the peer's cluster identifier
     */
    void restore(Cidr range, String clusterId);

    /**
     * Releases the reservation held for a cluster. Releasing a cluster without one is a no-op.
     *
     * @param clusterId the peer's cluster identifier
     */
    void release(String clusterId);
}
