package com.flagship.account_pro.account;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * In-memory, insertion-ordered account store.
 *
 * Invariants:
 * - ids come from a counter that only increases; deleted ids are never reused
 * - reads take the read lock, mutations take the write lock
 * - {@link #inTransaction(Supplier)} holds the write lock across a whole
 *   check-then-mutate sequence
 */
@Slf4j
public class AccountStore {

    private final List<Account> accounts = new ArrayList<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;
    private long nextId;

    /**
     * @param seed  accounts present at start-up, kept in the given order
     * @param clock source of creation dates
     */
    public AccountStore(List<Account> seed, Clock clock) {
        this.clock = clock;
        this.accounts.addAll(seed);
        this.nextId = seed.stream().mapToLong(Account::getId).max().orElse(0L) + 1;
    }

    public AccountStore(Clock clock) {
        this(List.of(), clock);
    }

    /**
     * Appends a new ACTIVE account dated today. Callers validate first.
     */
    public Account create(AccountDetails details) {
        lock.writeLock().lock();
        try {
            Account account = Account.create(nextId++, details, LocalDate.now(clock));
            accounts.add(account);
            log.debug("Stored account: id={}", account.getId());
            return account;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Account> findById(long id) {
        lock.readLock().lock();
        try {
            return accounts.stream()
                .filter(account -> account.getId() == id)
                .findFirst();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replaces the mutable fields of the matching account, keeping its position.
     *
     * @return the updated account, or empty if the id is unknown
     */
    public Optional<Account> update(long id, AccountDetails details) {
        lock.writeLock().lock();
        try {
            int index = indexOf(id);
            if (index < 0) {
                return Optional.empty();
            }
            Account updated = accounts.get(index).withDetails(details);
            accounts.set(index, updated);
            return Optional.of(updated);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return the removed account, or empty if the id is unknown
     */
    public Optional<Account> delete(long id) {
        lock.writeLock().lock();
        try {
            int index = indexOf(id);
            if (index < 0) {
                return Optional.empty();
            }
            return Optional.of(accounts.remove(index));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Accounts matching every present filter field, in insertion order.
     */
    public List<Account> list(AccountFilter filter) {
        lock.readLock().lock();
        try {
            return accounts.stream()
                .filter(filter::matches)
                .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Account> findAll() {
        return list(AccountFilter.none());
    }

    public int count() {
        lock.readLock().lock();
        try {
            return accounts.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Whether an account other than {@code excludingId} already holds the email.
     * Pass {@code null} to check against every account.
     */
    public boolean emailTaken(String email, Long excludingId) {
        lock.readLock().lock();
        try {
            return accounts.stream()
                .filter(account -> excludingId == null || account.getId() != excludingId)
                .anyMatch(account -> account.getEmail().equals(email));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Runs {@code work} while holding the write lock. The lock is reentrant,
     * so the work may call any other store method.
     */
    public <T> T inTransaction(Supplier<T> work) {
        lock.writeLock().lock();
        try {
            return work.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private int indexOf(long id) {
        for (int i = 0; i < accounts.size(); i++) {
            if (accounts.get(i).getId() == id) {
                return i;
            }
        }
        return -1;
    }
}
