package com.parley.security;

import com.parley.security.testing.TestIdentityFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Identity")
class IdentityTest {

    @Test
    @DisplayName("rejects a non-positive user id")
    void rejectsNonPositiveId() {
        assertThatThrownBy(() -> new Identity(0, "nobody", "nobody@parley.local"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("test factory derives username and email from the id")
    void factoryDefaults() {
        var identity = TestIdentityFactory.create(42);

        assertThat(identity.username()).isEqualTo("user42");
        assertThat(identity.email()).isEqualTo("user42@parley.local");
    }
}
