/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator.allocator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SubnetAllocator} that hands out replacement ranges from a fixed list of pools.
 * <p>
 * The cluster's own ranges are reserved for the allocator's lifetime. A peer whose range is free
 * keeps it, and the range is reserved under the peer's cluster identifier. A peer whose range
 * collides gets the first block of the same size, scanning the pools in order, that overlaps no
 * live reservation.
 */
public class PoolSubnetAllocator implements SubnetAllocator {

    private static final Logger LOGGER = LoggerFactory.getLogger(PoolSubnetAllocator.class);

    public static final List<Cidr> DEFAULT_POOLS = List.of(
            Cidr.parse("10.0.0.0/8"),
            Cidr.parse("172.16.0.0/12"),
            Cidr.parse("192.168.0.0/16"));

    private final List<Cidr> pools;
    private final List<Cidr> permanent;

    // guarded by this
    private final Map<String, Cidr> reservations = new LinkedHashMap<>();

    /**
     * @param pools the pools replacement ranges are taken from, in order of preference
     * @param permanent ranges that are never handed out, typically this cluster's pod and service ranges
     */
    public PoolSubnetAllocator(List<Cidr> pools, List<Cidr> permanent) {
        this.pools = List.copyOf(Objects.requireNonNull(pools));
        this.permanent = List.copyOf(Objects.requireNonNull(permanent));
    }

    public PoolSubnetAllocator(List<Cidr> permanent) {
        this(DEFAULT_POOLS, permanent);
    }

    @Override
    public synchronized Optional<Cidr> resolve(Cidr candidate, String clusterId) {
        Objects.requireNonNull(candidate);
        Objects.requireNonNull(clusterId);
        Cidr existing = reservations.get(clusterId);
        if (existing != null) {
            LOGGER.debug("Cluster {} already holds {}", clusterId, existing);
            return existing.equals(candidate) ? Optional.empty() : Optional.of(existing);
        }
        if (isFree(candidate)) {
            reservations.put(clusterId, candidate);
            LOGGER.info("Reserved {} for cluster {}, no remapping needed", candidate, clusterId);
            return Optional.empty();
        }
        Cidr replacement = findFree(candidate.prefixLength())
                .orElseThrow(() -> new SubnetExhaustedException("no free /" + candidate.prefixLength() + " left in pools " + pools
                        + " to remap " + candidate + " of cluster " + clusterId));
        reservations.put(clusterId, replacement);
        LOGGER.info("Range {} of cluster {} overlaps a reserved range, remapped to {}", candidate, clusterId, replacement);
        return Optional.of(replacement);
    }

    @Override
    public synchronized void restore(Cidr range, String clusterId) {
        Objects.requireNonNull(range);
        Objects.requireNonNull(clusterId);
        Cidr previous = reservations.remove(clusterId);
        if (range.equals(previous)) {
            reservations.put(clusterId, range);
            LOGGER.debug("Cluster {} already holds {}", clusterId, range);
            return;
        }
        if (!isFree(range)) {
            // the range is in use by the peer whatever else claims it, so it is kept regardless
            LOGGER.warn("Restored range {} of cluster {} overlaps another reserved range", range, clusterId);
        }
        reservations.put(clusterId, range);
        if (previous != null) {
            LOGGER.warn("Cluster {} held {}, replaced by restored range {}", clusterId, previous, range);
        }
        else {
            LOGGER.info("Restored reservation of {} for cluster {}", range, clusterId);
        }
    }

    @Override
    public synchronized void release(String clusterId) {
        Cidr released = reservations.remove(clusterId);
        if (released != null) {
            LOGGER.info("Released {} held by cluster {}", released, clusterId);
        }
        else {
            LOGGER.debug("Cluster {} held no reservation", clusterId);
        }
    }

    /**
     * @return a snapshot of the reservations held by peers, keyed by cluster identifier
     */
    public synchronized Map<String, Cidr> reservations() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(reservations));
    }

    private Optional<Cidr> findFree(int prefixLength) {
        for (Cidr pool : pools) {
            if (prefixLength < pool.prefixLength()) {
                continue;
            }
            long blockSize = 1L << (32 - prefixLength);
            for (long start = pool.firstAddress(); start + blockSize - 1 <= pool.lastAddress(); start += blockSize) {
                Cidr block = new Cidr(start, prefixLength);
                if (isFree(block)) {
                    return Optional.of(block);
                }
            }
        }
        return Optional.empty();
    }

    private boolean isFree(Cidr range) {
        List<Cidr> taken = new ArrayList<>(permanent);
        taken.addAll(reservations.values());
        return taken.stream().noneMatch(range::overlaps);
    }
}
