/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.odoomcp.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UtilsTests {

	@Test
	void hasTextRejectsNullAndBlank() {
		assertThat(Utils.hasText(null)).isFalse();
		assertThat(Utils.hasText(" \t")).isFalse();
		assertThat(Utils.hasText("crm")).isTrue();
	}

	@Test
	void stripTrailingSlashKeepsRoot() {
		assertThat(Utils.stripTrailingSlash("/messages/")).isEqualTo("/messages");
		assertThat(Utils.stripTrailingSlash("/messages")).isEqualTo("/messages");
		assertThat(Utils.stripTrailingSlash("/")).isEqualTo("/");
		assertThat(Utils.stripTrailingSlash(null)).isEmpty();
	}

	@Test
	void assertionsThrowIllegalArgument() {
		assertThatThrownBy(() -> Assert.notNull(null, "client must not be null"))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessage("client must not be null");
		assertThatThrownBy(() -> Assert.hasText("  ", "url must not be empty"))
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> Assert.isTrue(false, "port must be positive"))
			.isInstanceOf(IllegalArgumentException.class);
		assertThatCode(() -> Assert.hasText("http://odoo.local", "url must not be empty")).doesNotThrowAnyException();
	}

}
