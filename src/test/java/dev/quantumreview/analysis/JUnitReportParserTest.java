package dev.quantumreview.analysis;

import dev.quantumreview.domain.enums.TestStatus;
import dev.quantumreview.domain.valueobject.ParsedTestCase;
import dev.quantumreview.exception.ReportParseException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JUnitReportParserTest {

    @Test
    void readsStatusesDurationsAndTestIds() {
        String xml = """
                <?xml version="1.0" encoding="UTF-8"?>
                <testsuites>
                  <testsuite name="autoqa" tests="5">
                    <testcase name="T1::test_login" classname="tests.test_auth" time="0.25"/>
                    <testcase name="test_logout" classname="autoqa:T2" time="1.5">
                      <failure message="expected 200 got 500">trace</failure>
                    </testcase>
                    <testcase name="test_refresh" classname="tests.auth::T3">
                      <error>boom at line 3</error>
                    </testcase>
                    <testcase name="test_slow" classname="tests.perf" time="n/a">
                      <skipped/>
                    </testcase>
                    <testcase name="helper_check" classname="pkg::Helper"/>
                  </testsuite>
                </testsuites>
                """;

        List<ParsedTestCase> cases = JUnitReportParser.parse(xml);

        assertThat(cases).containsExactly(
                new ParsedTestCase("T1", "test_login", "tests.test_auth", TestStatus.PASSED, 250L, null),
                new ParsedTestCase("T2", "test_logout", "autoqa:T2", TestStatus.FAILED, 1500L, "expected 200 got 500"),
                new ParsedTestCase("T3", "test_refresh", "tests.auth::T3", TestStatus.FAILED, null, "boom at line 3"),
                new ParsedTestCase("test_slow", "test_slow", "tests.perf", TestStatus.SKIPPED, null, null),
                new ParsedTestCase("helper_check", "helper_check", "pkg::Helper", TestStatus.PASSED, null, null));
    }

    @Test
    void acceptsSingleSuiteRoot() {
        String xml = "<testsuite><testcase name=\"T9::x\" classname=\"c\" time=\"0\"/></testsuite>";

        assertThat(JUnitReportParser.parse(xml)).extracting(ParsedTestCase::testId).containsExactly("T9");
    }

    @Test
    void otherRootsYieldNothing() {
        assertThat(JUnitReportParser.parse("<coverage><testcase name=\"a\"/></coverage>")).isEmpty();
    }

    @Test
    void refusesDoctype() {
        String xml = """
                <?xml version="1.0"?>
                <!DOCTYPE testsuite [<!ENTITY xxe SYSTEM "file:///etc/passwd">]>
                <testsuite><testcase name="&xxe;"/></testsuite>
                """;

        assertThatThrownBy(() -> JUnitReportParser.parse(xml)).isInstanceOf(ReportParseException.class);
    }

    @Test
    void rejectsGarbage() {
        assertThatThrownBy(() -> JUnitReportParser.parse("not xml")).isInstanceOf(ReportParseException.class);
        assertThatThrownBy(() -> JUnitReportParser.parse("")).isInstanceOf(ReportParseException.class);
    }
}
