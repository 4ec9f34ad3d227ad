/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpdroid.util;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AssertTests {

	@Test
	void notNullRejectsNull() {
		assertThatThrownBy(() -> Assert.notNull(null, "value must not be null"))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessage("value must not be null");
		assertThatCode(() -> Assert.notNull("x", "unused")).doesNotThrowAnyException();
	}

	@Test
	void hasTextRejectsBlankStrings() {
		assertThatThrownBy(() -> Assert.hasText("  ", "blank")).isInstanceOf(IllegalArgumentException.class)
			.hasMessage("blank");
		assertThatThrownBy(() -> Assert.hasText(null, "null")).isInstanceOf(IllegalArgumentException.class);
		assertThat(Assert.isBlank(" a ")).isFalse();
		assertThat(Assert.isBlank("\t")).isTrue();
		assertThat(Assert.isBlank(null)).isTrue();
	}

	@Test
	void notEmptyRejectsEmptyCollections() {
		assertThatThrownBy(() -> Assert.notEmpty(List.of(), "empty")).isInstanceOf(IllegalArgumentException.class)
			.hasMessage("empty");
		assertThatCode(() -> Assert.notEmpty(List.of("a"), "unused")).doesNotThrowAnyException();
	}

	@Test
	void isTrueRejectsFalse() {
		assertThatThrownBy(() -> Assert.isTrue(false, "must hold")).isInstanceOf(IllegalArgumentException.class)
			.hasMessage("must hold");
	}

}
