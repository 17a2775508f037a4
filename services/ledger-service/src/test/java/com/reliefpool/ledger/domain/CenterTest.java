package com.reliefpool.ledger.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Center Entity Tests")
class CenterTest {

    private Center center;

    @BeforeEach
    void setUp() {
        center = Center.open("Shelter-A", 7L);
    }

    @Test
    @DisplayName("Should open with zero balance, contributions and supply")
    void shouldOpenEmpty() {
        assertThat(center.getId()).isNotNull();
        assertThat(center.getName()).isEqualTo("Shelter-A");
        assertThat(center.getCreatedEpoch()).isEqualTo(7L);
        assertThat(center.getBalance()).isZero();
        assertThat(center.getTotalContributions()).isZero();
        assertThat(center.getTokenSupply()).isZero();
    }

    @Test
    @DisplayName("Centers with the same name are different centers")
    void shouldAssignDistinctIds() {
        Center twin = Center.open("Shelter-A", 7L);

        assertThat(twin.getId()).isNotEqualTo(center.getId());
        assertThat(center.isSameCenter(twin.getId())).isFalse();
        assertThat(center.isSameCenter(center.getId())).isTrue();
    }

    @Nested
    @DisplayName("Balance Mutation Tests")
    class BalanceMutationTests {

        @Test
        @DisplayName("Should credit and debit the balance")
        void shouldCreditAndDebit() {
            center.credit(100L);
            center.debit(40L);

            assertThat(center.getBalance()).isEqualTo(60L);
        }

        @Test
        @DisplayName("Should allow debiting the full balance")
        void shouldDebitToZero() {
            center.credit(100L);
            center.debit(100L);

            assertThat(center.getBalance()).isZero();
        }

        @Test
        @DisplayName("Should refuse to overdraw")
        void shouldRefuseOverdraw() {
            center.credit(100L);

            assertThatThrownBy(() -> center.debit(101L))
                    .isInstanceOf(IllegalStateException.class);
            assertThat(center.getBalance()).isEqualTo(100L);
        }

        @ParameterizedTest
        @ValueSource(longs = {0L, -1L, Long.MIN_VALUE})
        @DisplayName("Should reject non-positive amounts")
        void shouldRejectNonPositive(long amount) {
            assertThatThrownBy(() -> center.credit(amount)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> center.debit(amount)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> center.recordContribution(amount)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> center.recordIssuance(amount)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should fail on balance overflow")
        void shouldFailOnOverflow() {
            center.credit(Long.MAX_VALUE);

            assertThatThrownBy(() -> center.credit(1L)).isInstanceOf(ArithmeticException.class);
            assertThat(center.getBalance()).isEqualTo(Long.MAX_VALUE);
        }
    }

    @Test
    @DisplayName("Copies are independent of the original")
    void shouldCopyIndependently() {
        center.credit(50L);
        Center copy = center.copy();

        copy.credit(25L);

        assertThat(center.getBalance()).isEqualTo(50L);
        assertThat(copy.getBalance()).isEqualTo(75L);
        assertThat(copy.getId()).isEqualTo(center.getId());
    }

    @Test
    @DisplayName("Snapshot reflects the current totals")
    void shouldSnapshot() {
        center.credit(30L);
        center.recordContribution(30L);
        center.recordIssuance(30L);

        CenterSnapshot snapshot = center.snapshot();

        assertThat(snapshot).isEqualTo(new CenterSnapshot(center.getId(), "Shelter-A", 30L, 30L, 30L, 7L));
    }
}
