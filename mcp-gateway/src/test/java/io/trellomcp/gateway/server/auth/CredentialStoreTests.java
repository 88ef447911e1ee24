/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.trellomcp.gateway.server.auth;

import java.util.Set;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CredentialStoreTests {

	@Test
	void parsesListsIgnoringBlankEntriesAndWhitespace() {
		CredentialStore store = CredentialStore.fromLists("  a@b ,  ,c@d", "rw-1,rw-2", null);

		assertThat(store.readOnlyCount()).isEqualTo(2);
		assertThat(store.readWriteCount()).isEqualTo(2);
		assertThat(store.resolve("a@b")).contains(Role.READ_ONLY);
		assertThat(store.resolve("c@d")).contains(Role.READ_ONLY);
		assertThat(store.resolve("rw-2")).contains(Role.READ_WRITE);
		assertThat(store.resolve(" a@b")).isEmpty();
	}

	@Test
	void readWriteWinsWhenTokenIsInBothSets() {
		CredentialStore store = CredentialStore.of(Set.of("shared", "ro"), Set.of("shared"));

		assertThat(store.resolve("shared")).contains(Role.READ_WRITE);
		assertThat(store.resolve("ro")).contains(Role.READ_ONLY);
	}

	@Test
	void rejectsUnknownAndEmptyTokens() {
		CredentialStore store = CredentialStore.fromLists("ro", "rw", null);

		assertThat(store.resolve("nope")).isEmpty();
		assertThat(store.resolve("")).isEmpty();
		assertThat(store.resolve(null)).isEmpty();
	}

	@Test
	void legacyListIsReadWriteWhenSplitListsAreEmpty() {
		CredentialStore store = CredentialStore.fromLists("", null, "old-1, old-2");

		assertThat(store.isOpenAccess()).isFalse();
		assertThat(store.resolve("old-1")).contains(Role.READ_WRITE);
		assertThat(store.resolve("old-2")).contains(Role.READ_WRITE);
	}

	@Test
	void legacyListIsIgnoredWhenSplitListsAreConfigured() {
		CredentialStore store = CredentialStore.fromLists("ro", null, "old-1");

		assertThat(store.resolve("old-1")).isEmpty();
		assertThat(store.resolve("ro")).contains(Role.READ_ONLY);
	}

	@Test
	void grantsReadWriteToEveryoneWhenNothingIsConfigured() {
		CredentialStore store = CredentialStore.fromLists(null, " , ", null);

		assertThat(store.isOpenAccess()).isTrue();
		assertThat(store.resolve("")).contains(Role.READ_WRITE);
		assertThat(store.resolve("anything")).contains(Role.READ_WRITE);
	}

	@Test
	void toStringDoesNotExposeCredentials() {
		CredentialStore store = CredentialStore.fromLists("secret-read-key", "secret-write-key", null);

		assertThat(store.toString()).doesNotContain("secret");
	}

}
