/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server.auth;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

import io.trellomcp.gateway.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static sets of bearer credentials per role, loaded once at startup and read-only
 * afterwards.
 * <p>
 * Resolution checks the read-write set before the read-only set, so a token configured
 * in both resolves to {@link Role#READ_WRITE}. When neither set holds any credential
 * the store is in open-access mode and every request resolves to
 * {@link Role#READ_WRITE}.
 */
public final class CredentialStore {

	private static final Logger logger = LoggerFactory.getLogger(CredentialStore.class);

	private final Set<String> readOnly;

	private final Set<String> readWrite;

	private CredentialStore(Set<String> readOnly, Set<String> readWrite) {
		this.readOnly = Collections.unmodifiableSet(new LinkedHashSet<>(readOnly));
		this.readWrite = Collections.unmodifiableSet(new LinkedHashSet<>(readWrite));
	}

	/**
	 * Creates a store from already parsed credential sets.
	 * @param readOnly the read-only credentials
	 * @param readWrite the read-write credentials
	 * @return the store
	 */
	public static CredentialStore of(Set<String> readOnly, Set<String> readWrite) {
		return new CredentialStore(readOnly, readWrite);
	}

	/**
	 * Creates a store from raw comma separated credential lists.
	 * @param readOnlyKeys read-only list, may be {@code null}
	 * @param readWriteKeys read-write list, may be {@code null}
	 * @param legacyKeys single list kept for backward compatibility; used as the
	 * read-write set only when both split lists are empty
	 * @return the store
	 */
	public static CredentialStore fromLists(String readOnlyKeys, String readWriteKeys, String legacyKeys) {
		Set<String> readOnly = Utils.commaDelimitedListToSet(readOnlyKeys);
		Set<String> readWrite = Utils.commaDelimitedListToSet(readWriteKeys);
		if (readOnly.isEmpty() && readWrite.isEmpty()) {
			Set<String> legacy = Utils.commaDelimitedListToSet(legacyKeys);
			if (!legacy.isEmpty()) {
				logger.info("Using legacy credential list as read-write credentials ({} keys)", legacy.size());
				readWrite = legacy;
			}
		}
		CredentialStore store = new CredentialStore(readOnly, readWrite);
		if (store.isOpenAccess()) {
			logger.info("No API keys configured, every request is granted read_write access");
		}
		else {
			logger.info("Loaded {} read-only and {} read-write API keys", store.readOnlyCount(),
					store.readWriteCount());
		}
		return store;
	}

	/**
	 * Whether no credential is configured at all.
	 * @return {@code true} if both sets are empty
	 */
	public boolean isOpenAccess() {
		return this.readOnly.isEmpty() && this.readWrite.isEmpty();
	}

	/**
	 * Resolves the role granted to a bearer token.
	 * @param token the token, empty when the request carried none
	 * @return the role, or empty if the token is not accepted
	 */
	public Optional<Role> resolve(String token) {
		if (isOpenAccess()) {
			return Optional.of(Role.READ_WRITE);
		}
		if (token == null || token.isEmpty()) {
			return Optional.empty();
		}
		if (this.readWrite.contains(token)) {
			return Optional.of(Role.READ_WRITE);
		}
		if (this.readOnly.contains(token)) {
			return Optional.of(Role.READ_ONLY);
		}
		return Optional.empty();
	}

	public int readOnlyCount() {
		return this.readOnly.size();
	}

	public int readWriteCount() {
		return this.readWrite.size();
	}

	@Override
	public String toString() {
		return "CredentialStore[readOnly=" + readOnlyCount() + ", readWrite=" + readWriteCount() + "]";
	}

}
