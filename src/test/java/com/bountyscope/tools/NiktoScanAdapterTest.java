package com.bountyscope.tools;

import com.bountyscope.core.model.ScanMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class NiktoScanAdapterTest {

    private static final String REPORT = """
            {"host": "a.example.com", "vulnerabilities": [
              {"id": "999986", "OSVDB": "0", "method": "GET", "url": "/",
               "msg": "The anti-clickjacking X-Frame-Options header is not present."},
              {"id": "000726", "OSVDB": "3268", "method": "GET", "url": "/icons/",
               "msg": "Directory indexing found."}
            ]}""";

    private ToolRunner runner;
    private ToolProperties properties;
    private NiktoScanAdapter adapter;

    @BeforeEach
    void setUp() {
        runner = mock(ToolRunner.class);
        properties = new ToolProperties();
        adapter = new NiktoScanAdapter(runner, properties);
    }

    @Test
    @DisplayName("plans one low-severity action named after the tuning classes")
    void plan() {
        var actions = adapter.plan("https://a.example.com", ScanMode.SAFE_SCAN);

        assertEquals(1, actions.size());
        assertEquals("scanner_nikto", actions.get(0).actionKind());
        assertEquals("nikto-tuning-123", actions.get(0).templateOrRuleId());
        assertEquals("low", actions.get(0).severityHint());
    }

    @Nested
    @DisplayName("run")
    class Run {

        @Test
        @DisplayName("reads the JSON report nikto writes and removes it afterwards")
        void readsReport() {
            var written = new Path[1];
            when(runner.run(anyList(), any(Duration.class))).thenAnswer(inv -> {
                List<String> command = inv.getArgument(0);
                written[0] = Path.of(command.get(command.indexOf("-output") + 1));
                Files.writeString(written[0], REPORT);
                return new ToolRunner.ToolResult(0, "", false);
            });

            var findings = adapter.run("https://a.example.com", new ScanConstraints("nikto-tuning-123", List.of("low"), null));

            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<String>> command = ArgumentCaptor.forClass(List.class);
            verify(runner).run(command.capture(), eq(Duration.ofMinutes(6)));
            var args = command.getValue();
            assertEquals("nikto", args.get(0));
            assertEquals("https://a.example.com", args.get(args.indexOf("-h") + 1));
            assertEquals("123", args.get(args.indexOf("-Tuning") + 1));
            assertEquals("300s", args.get(args.indexOf("-maxtime") + 1));
            assertTrue(args.contains("-nointeractive"));

            assertEquals(2, findings.size());
            assertEquals("Directory indexing found.", findings.get(1).getName());
            assertEquals("https://a.example.com/icons/", findings.get(1).getMatchedAt());
            assertEquals("3268", findings.get(1).getEvidence().get("osvdb"));
            assertFalse(Files.exists(written[0]));
        }

        @Test
        @DisplayName("returns no findings when nikto is missing")
        void missingBinary() {
            when(runner.run(anyList(), any(Duration.class)))
                    .thenThrow(new ToolUnavailableException("not found", new IOException("No such file")));

            assertTrue(adapter.run("https://a.example.com", new ScanConstraints("", List.of(), null)).isEmpty());
        }

        @Test
        @DisplayName("refuses non-http targets without running anything")
        void invalidTarget() {
            assertTrue(adapter.run("ftp://a.example.com", new ScanConstraints("", List.of(), null)).isEmpty());
            verifyNoInteractions(runner);
        }
    }

    @Nested
    @DisplayName("parseOutput")
    class ParseOutput {

        @Test
        @DisplayName("accepts a single host object and tags every item low")
        void singleHost() {
            var findings = adapter.parseOutput(REPORT, "https://a.example.com");

            assertEquals(2, findings.size());
            var first = findings.get(0);
            assertEquals("low", first.getSeverity());
            assertEquals("nikto", first.getScannerKind());
            assertEquals("999986", first.getTemplateId());
            assertEquals("https://a.example.com/", first.getMatchedAt());
        }

        @Test
        @DisplayName("accepts an array of hosts")
        void hostArray() {
            var findings = adapter.parseOutput("[" + REPORT + ", {\"vulnerabilities\": [{\"url\": \"\"}]}]",
                    "https://a.example.com");

            assertEquals(3, findings.size());
            assertEquals("Unknown", findings.get(2).getName());
            assertEquals("https://a.example.com", findings.get(2).getMatchedAt());
        }

        @Test
        @DisplayName("empty or malformed output yields no findings")
        void garbage() {
            assertTrue(adapter.parseOutput("", "https://a.example.com").isEmpty());
            assertTrue(adapter.parseOutput("{not json", "https://a.example.com").isEmpty());
            assertTrue(adapter.parseOutput("{\"host\": \"a\"}", "https://a.example.com").isEmpty());
        }
    }
}
