package com.example.sqlscriptrunner.service.sql.splitter.service;

import com.example.sqlscriptrunner.config.ErrorConfig;
import com.example.sqlscriptrunner.config.RunnerConfig;
import com.example.sqlscriptrunner.exception.ScriptReadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SqlSplitter")
class SqlSplitterTest {

    private final SqlSplitter splitter = new SqlSplitter();

    // ── plain statements ──────────────────────────────

    @Nested
    @DisplayName("plain statements")
    class Plain {

        @Test
        @DisplayName("splits on semicolons and trims each statement")
        void splitsAndTrims() {
            List<String> statements = splitter.split("  create table t (id int);\n insert into t values (1) ;\nselect * from t;");

            assertEquals(List.of("create table t (id int)", "insert into t values (1)", "select * from t"), statements);
        }

        @Test
        @DisplayName("keeps a trailing statement without semicolon")
        void keepsTrailingStatement() {
            assertEquals(List.of("select 1", "select 2"), splitter.split("select 1;\nselect 2\n"));
        }

        @Test
        @DisplayName("drops empty segments between and after boundaries")
        void dropsEmptySegments() {
            assertEquals(List.of("a", "b", "c"), splitter.split("a; b;; ;c;  \n\t"));
        }

        @Test
        @DisplayName("blank or separator-only scripts yield nothing")
        void blankScript() {
            assertTrue(splitter.split("").isEmpty());
            assertTrue(splitter.split("  \n\t ").isEmpty());
            assertTrue(splitter.split(";;;").isEmpty());
        }

        @Test
        @DisplayName("CRLF line endings are trimmed away")
        void crlf() {
            assertEquals(List.of("select 1", "select 2"), splitter.split("select 1;\r\nselect 2\r\n"));
        }

        @Test
        @DisplayName("result list is unmodifiable")
        void unmodifiable() {
            List<String> statements = splitter.split("select 1");
            assertThatThrownBy(() -> statements.add("x")).isInstanceOf(UnsupportedOperationException.class);
        }
    }

    // ── quotes ───────────────────────────────────────

    @Nested
    @DisplayName("quoted text")
    class Quotes {

        @Test
        @DisplayName("semicolon in single-quoted literal does not split")
        void singleQuoted() {
            assertEquals(List.of("select ';' as a"), splitter.split("select ';' as a;"));
        }

        @Test
        @DisplayName("semicolon in double-quoted identifier does not split")
        void doubleQuoted() {
            assertEquals(List.of("select \"a;b\" from t", "select 2"), splitter.split("select \"a;b\" from t; select 2"));
        }

        @Test
        @DisplayName("doubled single quote stays inside the literal")
        void doubledQuote() {
            assertEquals(List.of("select 'it''s; fine'", "select 2"), splitter.split("select 'it''s; fine'; select 2"));
        }

        @Test
        @DisplayName("backslash does not escape a quote")
        void backslashIsNotAnEscape() {
            assertEquals(List.of("select 'a\\'", "select 2"), splitter.split("select 'a\\'; select 2"));
        }

        @Test
        @DisplayName("comment markers inside a literal are plain text")
        void commentMarkerInLiteral() {
            assertEquals(List.of("select '--'", "select '/*'", "select 3"),
                    splitter.split("select '--'; select '/*'; select 3"));
        }

        @Test
        @DisplayName("double quote inside single quotes does not open an identifier")
        void mixedQuotes() {
            assertEquals(List.of("select 'say \"hi;'", "select 2"), splitter.split("select 'say \"hi;'; select 2"));
        }
    }

    // ── comments ─────────────────────────────────────

    @Nested
    @DisplayName("comments")
    class Comments {

        @Test
        @DisplayName("comments stay with the adjacent statement")
        void exampleScript() {
            String sql = """
                    -- keep ; in comment
                    select ';' as a;
                    /* block ; comment */
                    update users set name = 'x;y' where id = 1;
                    """;

            List<String> statements = splitter.split(sql);

            assertEquals(2, statements.size());
            assertEquals("-- keep ; in comment\nselect ';' as a", statements.get(0));
            assertEquals("/* block ; comment */\nupdate users set name = 'x;y' where id = 1", statements.get(1));
        }

        @Test
        @DisplayName("quote inside a line comment is ignored")
        void quoteInLineComment() {
            assertEquals(List.of("-- it's\nselect 1", "select 2"), splitter.split("-- it's\nselect 1; select 2"));
        }

        @Test
        @DisplayName("trailing line comment becomes its own statement")
        void trailingLineComment() {
            assertEquals(List.of("select 1", "-- trailing ; comment"), splitter.split("select 1; -- trailing ; comment"));
        }

        @Test
        @DisplayName("block comment spans lines and ignores inner markers")
        void blockComment() {
            String sql = "/* line one;\n -- not a line comment ' still comment\n*/ select 1; select 2";
            assertEquals(List.of("/* line one;\n -- not a line comment ' still comment\n*/ select 1", "select 2"),
                    splitter.split(sql));
        }

        @Test
        @DisplayName("slash right after the opener does not close a block comment")
        void slashAfterOpener() {
            assertEquals(List.of("/*/ ; */ x"), splitter.split("/*/ ; */ x"));
        }

        @Test
        @DisplayName("single minus is an operator, not a comment")
        void singleMinus() {
            assertEquals(List.of("select 3 - 1", "select 2"), splitter.split("select 3 - 1; select 2"));
        }
    }

    // ── dollar quoting ───────────────────────────────

    @Nested
    @DisplayName("dollar-quoted bodies")
    class DollarQuoted {

        @Test
        @DisplayName("anonymous $$ body spanning lines is one statement")
        void anonymousTag() {
            String sql = """
                    create function one() returns int as $$
                    begin
                      return 1;
                    end;
                    $$ language plpgsql;
                    select one();
                    """;

            List<String> statements = splitter.split(sql);

            assertEquals(2, statements.size());
            assertThat(statements.get(0))
                    .startsWith("create function one()")
                    .contains("return 1;")
                    .endsWith("$$ language plpgsql");
            assertEquals("select one()", statements.get(1));
        }

        @Test
        @DisplayName("named tag only closes on the same tag")
        void namedTag() {
            String sql = "do $body$ begin perform 1; $$ nested; end $body$; select 1";
            assertEquals(List.of("do $body$ begin perform 1; $$ nested; end $body$", "select 1"), splitter.split(sql));
        }

        @Test
        @DisplayName("quotes and comment markers inside the body are not interpreted")
        void bodyIsOpaque() {
            assertEquals(List.of("select $$it's; -- /*$$", "select 2"), splitter.split("select $$it's; -- /*$$; select 2"));
        }

        @Test
        @DisplayName("positional parameters like $1 stay literal")
        void positionalParameters() {
            assertEquals(List.of("select $1, $2", "select 3"), splitter.split("select $1, $2; select 3"));
        }

        @Test
        @DisplayName("lone dollar at end of input is literal")
        void loneDollar() {
            assertEquals(List.of("select 'a' || $abc", "select $"), splitter.split("select 'a' || $abc; select $"));
        }

        @Test
        @DisplayName("tag longer than the lookahead window is not a tag")
        void tagBeyondWindow() {
            String longWord = "x".repeat(70);
            String sql = "$" + longWord + "$; select 1";

            assertEquals(List.of("$" + longWord + "$", "select 1"), splitter.split(sql));
            assertEquals(List.of(sql), new SqlSplitter(128).split(sql));
        }

        @Test
        @DisplayName("window size comes from RunnerConfig")
        void windowFromConfig() {
            RunnerConfig config = new RunnerConfig();
            config.setLookaheadWindow(4);
            SqlSplitter small = new SqlSplitter(config);

            assertEquals(List.of("$abcd$", "x"), small.split("$abcd$; x"));
            assertEquals(List.of("$abc$; x"), small.split("$abc$; x"));
        }

        @Test
        @DisplayName("window smaller than two is rejected")
        void tinyWindow() {
            assertThrows(IllegalArgumentException.class, () -> new SqlSplitter(1));
        }
    }

    // ── unterminated constructs ──────────────────────

    @Nested
    @DisplayName("unterminated constructs")
    class Unterminated {

        @Test
        @DisplayName("unclosed block comment becomes the last statement")
        void blockComment() {
            assertEquals(List.of("select 1", "/* never closed"), splitter.split("select 1; /* never closed"));
        }

        @Test
        @DisplayName("unclosed literal swallows the rest of the script")
        void literal() {
            assertEquals(List.of("select 1", "select 'oops; select 2"), splitter.split("select 1; select 'oops; select 2"));
        }

        @Test
        @DisplayName("unclosed dollar body swallows the rest of the script")
        void dollarBody() {
            assertEquals(List.of("do $f$ begin; end;"), splitter.split("do $f$ begin; end;"));
        }
    }

    // ── idempotence & sources ────────────────────────

    @Test
    @DisplayName("re-splitting an emitted statement returns it unchanged")
    void idempotent() {
        String sql = """
                -- header ; comment
                create table t (id int, name varchar(20));
                insert into t values (1, 'a;b''c');
                /* note */ select "id" from t;
                do $x$ begin null; end $x$;
                select $1 from t; /* tail
                """;

        List<String> statements = splitter.split(sql);

        assertEquals(6, statements.size());
        for (String statement : statements) {
            assertEquals(List.of(statement), splitter.split(statement));
        }
    }

    @Test
    @DisplayName("reader and string inputs give the same result")
    void readerMatchesString() {
        String sql = "select ';'; -- c\nselect $$;$$; /* x */ select 3";
        assertEquals(splitter.split(sql), splitter.split(new StringReader(sql)));
    }

    @Test
    @DisplayName("read fault surfaces as ScriptReadException")
    void readFault() {
        Reader failing = new Reader() {
            private boolean served;

            @Override
            public int read(char[] cbuf, int off, int len) throws IOException {
                if (served) throw new IOException("disk gone");
                served = true;
                cbuf[off] = 's';
                return 1;
            }

            @Override
            public void close() {
            }
        };

        ScriptReadException ex = assertThrows(ScriptReadException.class, () -> splitter.split(failing));
        assertEquals(ErrorConfig.SCRIPT_READ_FAILED, ex.getErrorCode());
        assertEquals("disk gone", ex.getCause().getMessage());
    }

    @Test
    @DisplayName("null input is rejected")
    void nullInput() {
        assertThrows(NullPointerException.class, () -> splitter.split((String) null));
        assertThrows(NullPointerException.class, () -> splitter.split((Reader) null));
    }
}
