package com.conduitsystems.registry;

import com.conduitsystems.address.Address;
import com.conduitsystems.mailbox.MailboxHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Maps addresses to mailbox handles. Lookups never block each other; writers only
 * contend on the bins they touch.
 *
 * <p>Each entry caches the address's routing key so repeat lookups by key skip hashing
 * the address again. Addresses of type {@link Address.PoolMember} are also grouped by pool
 * for load-balanced selection.
 */
public class ActorRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ActorRegistry.class);

    private final ConcurrentHashMap<Address, Entry> entries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, Address> routingKeys = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Address>> pools = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> poolCursors = new ConcurrentHashMap<>();
    private volatile boolean closed;

    private record Entry(MailboxHandle mailbox, long routingKey) {
    }

    /**
     * Registers the mailbox under the address, replacing any previous registration.
     *
     * @throws RegistryException if the registry has been closed
     */
    public void register(Address address, MailboxHandle mailbox) {
        Objects.requireNonNull(address, "address cannot be null");
        Objects.requireNonNull(mailbox, "mailbox cannot be null");
        if (closed) {
            throw new RegistryException("Registry is closed, cannot register " + address);
        }

        long routingKey = address.routingKey();
        Entry previous = entries.put(address, new Entry(mailbox, routingKey));
        routingKeys.put(routingKey, address);
        if (address instanceof Address.PoolMember member) {
            pools.compute(member.pool(), (pool, members) -> {
                CopyOnWriteArrayList<Address> joined = members == null ? new CopyOnWriteArrayList<>() : members;
                joined.addIfAbsent(address);
                return joined;
            });
        }

        if (previous != null) {
            logger.debug("Replaced registration of {}", address);
        } else {
            logger.debug("Registered {}", address);
        }
    }

    /**
     * Removes the address, its routing-key cache entry and its pool membership.
     *
     * @throws AddressNotFoundException if nothing is registered under the address
     */
    public MailboxHandle unregister(Address address) {
        Objects.requireNonNull(address, "address cannot be null");
        Entry removed = entries.remove(address);
        if (removed == null) {
            throw new AddressNotFoundException(address);
        }
        routingKeys.remove(removed.routingKey(), address);
        if (address instanceof Address.PoolMember member) {
            pools.computeIfPresent(member.pool(), (pool, members) -> {
                members.remove(address);
                return members.isEmpty() ? null : members;
            });
        }
        logger.debug("Unregistered {}", address);
        return removed.mailbox();
    }

    /**
     * @throws AddressNotFoundException if nothing is registered under the address
     */
    public MailboxHandle resolve(Address address) {
        Objects.requireNonNull(address, "address cannot be null");
        Entry entry = entries.get(address);
        if (entry == null) {
            throw new AddressNotFoundException(address);
        }
        return entry.mailbox();
    }

    public Optional<MailboxHandle> find(Address address) {
        Entry entry = entries.get(address);
        return entry == null ? Optional.empty() : Optional.of(entry.mailbox());
    }

    /**
     * Looks an entry up by its cached routing key.
     */
    public Optional<MailboxHandle> resolveByRoutingKey(long routingKey) {
        Address address = routingKeys.get(routingKey);
        if (address == null) {
            return Optional.empty();
        }
        return find(address);
    }

    /**
     * Picks one member of the pool.
     *
     * @return the chosen member, or empty if the pool has no members
     */
    public Optional<Address> poolMember(String poolName, PoolStrategy strategy) {
        Objects.requireNonNull(poolName, "poolName cannot be null");
        List<Address> members = pools.get(poolName);
        if (members == null) {
            return Optional.empty();
        }
        // snapshot: a concurrent unregister may shrink the list between size() and get()
        Object[] snapshot = members.toArray();
        if (snapshot.length == 0) {
            return Optional.empty();
        }

        int index;
        switch (strategy) {
            case ROUND_ROBIN:
                int tick = poolCursors.computeIfAbsent(poolName, pool -> new AtomicInteger()).getAndIncrement();
                index = Math.floorMod(tick, snapshot.length);
                break;
            case RANDOM:
                index = ThreadLocalRandom.current().nextInt(snapshot.length);
                break;
            default:
                throw new IllegalArgumentException("Unknown pool strategy: " + strategy);
        }
        return Optional.of((Address) snapshot[index]);
    }

    public boolean contains(Address address) {
        return entries.containsKey(address);
    }

    public int actorCount() {
        return entries.size();
    }

    public int poolCount() {
        return pools.size();
    }

    public int poolSize(String poolName) {
        List<Address> members = pools.get(poolName);
        return members == null ? 0 : members.size();
    }

    public Set<Address> addresses() {
        return Set.copyOf(entries.keySet());
    }

    /**
     * Closes every registered mailbox and rejects further registrations.
     */
    public void close() {
        closed = true;
        entries.values().forEach(entry -> entry.mailbox().close());
        entries.clear();
        routingKeys.clear();
        pools.clear();
        poolCursors.clear();
        logger.debug("Registry closed");
    }

    public boolean isClosed() {
        return closed;
    }
}
