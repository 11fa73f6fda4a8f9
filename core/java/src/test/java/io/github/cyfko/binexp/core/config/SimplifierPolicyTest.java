package io.github.cyfko.binexp.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SimplifierPolicy Tests")
class SimplifierPolicyTest {

    @Test
    void presetsShouldCombineModes() {
        assertEquals(ConvergenceMode.ANY_RULE, SimplifierPolicy.defaults().convergence());
        assertEquals(DivisionByZeroPolicy.FAIL, SimplifierPolicy.defaults().divisionByZero());

        assertEquals(ConvergenceMode.FOLDING_DRIVEN, SimplifierPolicy.reference().convergence());
        assertEquals(DivisionByZeroPolicy.FAIL, SimplifierPolicy.reference().divisionByZero());

        assertEquals(ConvergenceMode.ANY_RULE, SimplifierPolicy.lenient().convergence());
        assertEquals(DivisionByZeroPolicy.LEAVE_UNFOLDED, SimplifierPolicy.lenient().divisionByZero());
    }

    @Test
    void builderShouldStartFromDefaults() {
        SimplifierPolicy policy = SimplifierPolicy.builder().policyName("mine").build();

        assertEquals("mine", policy.policyName());
        assertEquals(ConvergenceMode.ANY_RULE, policy.convergence());
        assertEquals(DivisionByZeroPolicy.FAIL, policy.divisionByZero());
    }

    @Test
    void shouldRejectMissingValues() {
        assertThrows(IllegalArgumentException.class, () -> SimplifierPolicy.builder().policyName(null).build());
        assertThrows(IllegalArgumentException.class, () -> SimplifierPolicy.builder().convergence(null).build());
        assertThrows(IllegalArgumentException.class, () -> SimplifierPolicy.builder().divisionByZero(null).build());
    }
}
