/**
 * Append-only event log: the store contract, its envelope, concurrency and claim semantics.
 *
 * <p>Implementations live in {@code jdbc} (PostgreSQL/H2 via Spring JDBC) and {@code inmemory}.
 */
package com.zeus.people.eventstore;
