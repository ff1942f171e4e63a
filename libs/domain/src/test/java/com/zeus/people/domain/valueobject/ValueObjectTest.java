package com.zeus.people.domain.valueobject;

import com.zeus.people.domain.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Value objects")
class ValueObjectTest {

    @Nested
    @DisplayName("EmpNr")
    class EmpNrTests {

        @Test
        @DisplayName("accepts two uppercase letters followed by four digits")
        void acceptsValidFormat() {
            assertThat(EmpNr.of("AB1234").value()).isEqualTo("AB1234");
        }

        @ParameterizedTest
        @ValueSource(strings = {"ab1234", "A12345", "AB123", "AB12345", "AB12C4"})
        @DisplayName("rejects malformed numbers")
        void rejectsMalformed(String raw) {
            assertThatThrownBy(() -> EmpNr.of(raw))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("employee number");
        }

        @Test
        @DisplayName("reports every failed rule at once")
        void reportsAllErrors() {
            var result = EmpNr.validate("abc");
            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).hasSize(2);
        }

        @Test
        @DisplayName("blank input reports only the emptiness error")
        void blankInput() {
            assertThat(EmpNr.validate("  ").errors()).containsExactly("Employee number cannot be empty");
        }
    }

    @Nested
    @DisplayName("EmpName")
    class EmpNameTests {

        @Test
        @DisplayName("accepts letters, spaces, hyphens and dots")
        void acceptsNames() {
            assertThat(EmpName.of("Smith J.").value()).isEqualTo("Smith J.");
            assertThat(EmpName.of("Ann-Marie Jones").value()).isEqualTo("Ann-Marie Jones");
        }

        @Test
        @DisplayName("rejects digits and names over 100 characters")
        void rejectsInvalid() {
            assertThatThrownBy(() -> EmpName.of("R2D2")).isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> EmpName.of("a".repeat(101))).isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("Rank")
    class RankTests {

        @Test
        @DisplayName("maps each rank to its ensured access level")
        void ensuredAccessLevel() {
            assertThat(Rank.professor().ensuredAccessLevel()).isEqualTo(AccessLevel.national());
            assertThat(Rank.seniorLecturer().ensuredAccessLevel()).isEqualTo(AccessLevel.international());
            assertThat(Rank.lecturer().ensuredAccessLevel()).isEqualTo(AccessLevel.local());
        }

        @Test
        @DisplayName("rejects unknown codes")
        void rejectsUnknown() {
            assertThatThrownBy(() -> Rank.of("X"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("Rank must be 'P'");
        }

        @Test
        @DisplayName("predicates follow the code")
        void predicates() {
            assertThat(Rank.of("P").isProfessor()).isTrue();
            assertThat(Rank.of("SL").isSeniorLecturer()).isTrue();
            assertThat(Rank.of("L").isLecturer()).isTrue();
            assertThat(Rank.of("L").isProfessor()).isFalse();
        }
    }

    @Nested
    @DisplayName("MoneyAmt")
    class MoneyAmtTests {

        @Test
        @DisplayName("zero is a valid amount")
        void zeroAllowed() {
            assertThat(MoneyAmt.zero().value()).isEqualByComparingTo(BigDecimal.ZERO);
            assertThat(MoneyAmt.of("0")).isEqualTo(MoneyAmt.zero());
        }

        @Test
        @DisplayName("equality ignores trailing zeros")
        void scaleInsensitiveEquality() {
            assertThat(MoneyAmt.of("10")).isEqualTo(MoneyAmt.of("10.00"));
            assertThat(MoneyAmt.of("10").hashCode()).isEqualTo(MoneyAmt.of("10.0").hashCode());
        }

        @Test
        @DisplayName("keeps fractions of a cent and rounds only for display")
        void subCentPrecision() {
            var amount = MoneyAmt.of("0.125");

            assertThat(amount.value()).isEqualByComparingTo("0.125");
            assertThat(amount).isNotEqualTo(MoneyAmt.of("0.13"));
            assertThat(MoneyAmt.of("12.50").value().scale()).isEqualTo(1);
            assertThat(amount.toString()).isEqualTo("$0.13");
        }

        @Test
        @DisplayName("rejects negative amounts and non-numbers")
        void rejectsInvalid() {
            assertThatThrownBy(() -> MoneyAmt.of("-0.01")).isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> MoneyAmt.of("ten")).isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("arithmetic keeps the amount non-negative")
        void arithmetic() {
            assertThat(MoneyAmt.of("1.50").plus(MoneyAmt.of("2.50"))).isEqualTo(MoneyAmt.of("4"));
            assertThatThrownBy(() -> MoneyAmt.of("1").minus(MoneyAmt.of("2")))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("formats as dollars with two decimals")
        void formatting() {
            assertThat(MoneyAmt.of("1500").toString()).isEqualTo("$1500.00");
        }
    }

    @Nested
    @DisplayName("Rating")
    class RatingTests {

        @Test
        @DisplayName("accepts the inclusive range 1 to 7")
        void bounds() {
            assertThat(Rating.of(1)).isEqualTo(Rating.minimum());
            assertThat(Rating.of(7)).isEqualTo(Rating.maximum());
        }

        @ParameterizedTest
        @ValueSource(ints = {0, 8, -1})
        @DisplayName("rejects values outside the range")
        void outOfRange(int raw) {
            assertThatThrownBy(() -> Rating.of(raw)).isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("Identifiers and names")
    class TextValueTests {

        @Test
        @DisplayName("room numbers allow letters, digits, hyphens and dots up to 10 characters")
        void roomNr() {
            assertThat(RoomNr.of("B1-101").value()).isEqualTo("B1-101");
            assertThatThrownBy(() -> RoomNr.of("101 A")).isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> RoomNr.of("12345678901")).isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("extension numbers are digits only")
        void extNr() {
            assertThat(ExtNr.of("4711").value()).isEqualTo("4711");
            assertThatThrownBy(() -> ExtNr.of("47a1")).isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("phone numbers allow digits and separators")
        void phoneNr() {
            assertThat(PhoneNr.of("+1 (555) 123-4567").value()).isEqualTo("+1 (555) 123-4567");
            assertThatThrownBy(() -> PhoneNr.of("call me")).isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("building number and name must not be blank")
        void building() {
            assertThat(BldgNr.of("B1").value()).isEqualTo("B1");
            assertThat(BldgName.of("Science Hall").value()).isEqualTo("Science Hall");
            assertThatThrownBy(() -> BldgNr.of(" ")).isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> BldgName.of("")).isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("access levels are LOC, INT or NAT")
        void accessLevel() {
            assertThat(AccessLevel.of("NAT").isNational()).isTrue();
            assertThatThrownBy(() -> AccessLevel.of("GLOBAL")).isInstanceOf(ValidationException.class);
        }
    }
}
