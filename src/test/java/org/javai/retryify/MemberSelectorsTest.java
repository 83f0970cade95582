package org.javai.retryify;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class MemberSelectorsTest {

    @Test
    void publicNames_rejectsUnderscorePrefixedNames() {
        assertThat(MemberSelectors.publicNames().test("getTrack")).isTrue();
        assertThat(MemberSelectors.publicNames().test("_request")).isFalse();
    }

    @Test
    void named_andExcluding_areComplements() {
        assertThat(MemberSelectors.named("a", "b").test("a")).isTrue();
        assertThat(MemberSelectors.named("a", "b").test("c")).isFalse();
        assertThat(MemberSelectors.excluding("a", "b").test("a")).isFalse();
        assertThat(MemberSelectors.excluding("a", "b").test("c")).isTrue();
    }

    @Test
    void all_acceptsEverything() {
        assertThat(MemberSelectors.all().test("")).isTrue();
        assertThat(MemberSelectors.all().test("_x")).isTrue();
    }
}
