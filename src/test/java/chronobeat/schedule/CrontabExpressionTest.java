package chronobeat.schedule;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class CrontabExpressionTest {

    private static LocalDateTime at(String iso) {
        return LocalDateTime.parse(iso);
    }

    @Test
    void wildcardMatchesEveryMinute() {
        CrontabExpression expr = CrontabExpression.parse("* * * * *");

        assertTrue(expr.matches(at("2024-01-01T00:00")));
        assertTrue(expr.matches(at("2024-07-15T13:37")));
        assertEquals(at("2024-01-01T10:31"), expr.nextMatch(at("2024-01-01T10:31:45")));
    }

    @Test
    void topOfHour() {
        CrontabExpression expr = CrontabExpression.parse("0 * * * *");

        assertTrue(expr.matches(at("2024-01-01T10:00")));
        assertFalse(expr.matches(at("2024-01-01T10:30")));
        assertEquals(at("2024-01-01T11:00"), expr.nextMatch(at("2024-01-01T10:01")));
    }

    @Test
    @DisplayName("Carry rolls minute into hour, day, month and year")
    void carriesAcrossUnits() {
        CrontabExpression expr = CrontabExpression.parse("30 9 1 1 *");

        assertEquals(at("2025-01-01T09:30"), expr.nextMatch(at("2024-01-01T09:31")));
        assertEquals(at("2024-01-01T09:30"), expr.nextMatch(at("2023-12-31T23:59")));
    }

    @Test
    void stepsAndRanges() {
        CrontabExpression expr = CrontabExpression.parse("*/15 9-17/4 * * *");

        assertTrue(expr.matches(at("2024-03-04T09:45")));
        assertTrue(expr.matches(at("2024-03-04T13:00")));
        assertTrue(expr.matches(at("2024-03-04T17:15")));
        assertFalse(expr.matches(at("2024-03-04T10:00")));
        assertFalse(expr.matches(at("2024-03-04T09:10")));
        assertEquals(at("2024-03-05T09:00"), expr.nextMatch(at("2024-03-04T17:46")));
    }

    @Test
    @DisplayName("n/step means n to the end of the range")
    void startWithStep() {
        CrontabExpression expr = CrontabExpression.parse("5/20 * * * *");

        assertTrue(expr.matches(at("2024-01-01T00:05")));
        assertTrue(expr.matches(at("2024-01-01T00:25")));
        assertTrue(expr.matches(at("2024-01-01T00:45")));
        assertFalse(expr.matches(at("2024-01-01T00:00")));
    }

    @Test
    void namesForMonthsAndWeekdays() {
        CrontabExpression expr = CrontabExpression.parse("0 8 * feb-mar mon-fri");

        // 2024-02-05 is a Monday
        assertTrue(expr.matches(at("2024-02-05T08:00")));
        // Saturday
        assertFalse(expr.matches(at("2024-02-10T08:00")));
        // January
        assertFalse(expr.matches(at("2024-01-08T08:00")));
        assertEquals(at("2024-02-01T08:00"), expr.nextMatch(at("2024-01-15T00:00")));
    }

    @Test
    @DisplayName("Sunday is both 0 and 7")
    void sundayAliases() {
        // 2024-01-07 is a Sunday
        assertTrue(CrontabExpression.parse("0 0 * * 0").matches(at("2024-01-07T00:00")));
        assertTrue(CrontabExpression.parse("0 0 * * 7").matches(at("2024-01-07T00:00")));
        assertTrue(CrontabExpression.parse("0 0 * * sun").matches(at("2024-01-07T00:00")));
        assertFalse(CrontabExpression.parse("0 0 * * 7").matches(at("2024-01-08T00:00")));
    }

    @Test
    @DisplayName("Restricted day-of-month and day-of-week are OR'd")
    void restrictedDaysAreOred() {
        CrontabExpression expr = CrontabExpression.parse("0 0 13 * 5");

        // Friday 2024-01-05, not the 13th
        assertTrue(expr.matches(at("2024-01-05T00:00")));
        // Saturday 2024-01-13
        assertTrue(expr.matches(at("2024-01-13T00:00")));
        // Thursday 2024-01-11
        assertFalse(expr.matches(at("2024-01-11T00:00")));
    }

    @Test
    @DisplayName("A wildcard day field leaves only the other one as constraint")
    void wildcardDayFieldIsAnd() {
        CrontabExpression byDom = CrontabExpression.parse("0 0 13 * *");
        assertTrue(byDom.matches(at("2024-01-13T00:00")));
        assertFalse(byDom.matches(at("2024-01-05T00:00")));

        CrontabExpression byDow = CrontabExpression.parse("0 0 * * 5");
        assertTrue(byDow.matches(at("2024-01-05T00:00")));
        assertFalse(byDow.matches(at("2024-01-13T00:00")));

        // "*/2" still counts as a wildcard for the day rule
        CrontabExpression stepped = CrontabExpression.parse("0 0 */2 * 5");
        // Fridays 2024-01-19 (odd day) and 2024-01-12 (even day)
        assertTrue(stepped.matches(at("2024-01-19T00:00")));
        assertFalse(stepped.matches(at("2024-01-12T00:00")));
    }

    @Test
    void leapDay() {
        CrontabExpression expr = CrontabExpression.parse("0 12 29 2 *");

        assertEquals(at("2028-02-29T12:00"), expr.nextMatch(at("2024-03-01T00:00")));
    }

    @Test
    void neverMatchingExpressionFailsSearch() {
        CrontabExpression expr = CrontabExpression.parse("0 0 31 2 *");

        assertThrows(IllegalStateException.class, () -> expr.nextMatch(at("2024-01-01T00:00")));
    }

    @Test
    void rejectsMalformedFields() {
        assertThrows(IllegalArgumentException.class, () -> CrontabExpression.parse("60 * * * *"));
        assertThrows(IllegalArgumentException.class, () -> CrontabExpression.parse("* 24 * * *"));
        assertThrows(IllegalArgumentException.class, () -> CrontabExpression.parse("* * 0 * *"));
        assertThrows(IllegalArgumentException.class, () -> CrontabExpression.parse("* * * 13 *"));
        assertThrows(IllegalArgumentException.class, () -> CrontabExpression.parse("* * * * 8"));
        assertThrows(IllegalArgumentException.class, () -> CrontabExpression.parse("*/0 * * * *"));
        assertThrows(IllegalArgumentException.class, () -> CrontabExpression.parse("5-1 * * * *"));
        assertThrows(IllegalArgumentException.class, () -> CrontabExpression.parse("abc * * * *"));
        assertThrows(IllegalArgumentException.class, () -> CrontabExpression.parse("1,,2 * * * *"));
        assertThrows(IllegalArgumentException.class, () -> CrontabExpression.parse("* * * *"));
        assertThrows(IllegalArgumentException.class, () -> CrontabExpression.parse("1/2147483647 * * * *"));
        assertThrows(IllegalArgumentException.class, () -> CrontabExpression.parse("*/60 * * * *"));
        assertThrows(IllegalArgumentException.class, () -> CrontabExpression.parse("* * * * 9-10/x"));
    }

    @Test
    void stepLongerThanTheFieldIsNamedInTheError() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CrontabExpression.parse("0", "*/4096", "*", "*", "*"));

        assertEquals("hour: step in '*/4096' must be between 1 and 23", e.getMessage());
    }

    @Test
    void widestStepMatchesBothEnds() {
        CrontabExpression expr = CrontabExpression.parse("*/59 * * * *");

        assertTrue(expr.matches(at("2024-01-01T00:00")));
        assertFalse(expr.matches(at("2024-01-01T00:30")));
        assertEquals(at("2024-01-01T00:59"), expr.nextMatch(at("2024-01-01T00:01")));
    }

    @Test
    @DisplayName("Stepped day of month ANDed with a weekday finds the next common day")
    void steppedDayOfMonthWithWeekdaySearch() {
        CrontabExpression expr = CrontabExpression.parse("0 6 */2 * 5");

        // 2024-01-05 is a Friday on an odd day; the 12th is even, the 19th odd
        assertEquals(at("2024-01-19T06:00"), expr.nextMatch(at("2024-01-05T06:01")));
    }

    @Test
    void restrictedDaysSearchTakesWhicheverComesFirst() {
        CrontabExpression expr = CrontabExpression.parse("0 0 13 * 5");

        assertEquals(at("2024-01-05T00:00"), expr.nextMatch(at("2024-01-01T00:00")));
        assertEquals(at("2024-01-12T00:00"), expr.nextMatch(at("2024-01-05T00:01")));
        assertEquals(at("2024-01-13T00:00"), expr.nextMatch(at("2024-01-12T00:01")));
    }

    @Test
    void errorMessageNamesTheField() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CrontabExpression.parse("0", "25", "*", "*", "*"));
        assertTrue(e.getMessage().startsWith("hour"), e.getMessage());
    }
}
