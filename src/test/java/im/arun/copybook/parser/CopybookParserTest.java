package im.arun.copybook.parser;

import im.arun.copybook.exception.CopybookException;
import im.arun.copybook.exception.GrammarException;
import im.arun.copybook.model.Node;
import im.arun.copybook.model.NodeType;
import im.arun.copybook.model.UsageType;
import im.arun.copybook.picture.PictureType;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CopybookParserTest {
    private final CopybookParser parser = new CopybookParser();

    private static final String SIMPLE = "01 REC.\n"
        + "  05 FIELD-A PIC X(10).\n"
        + "  05 FIELD-B PIC 9(5)V99 USAGE COMP-3.";

    @Test
    void testSimpleRecord() {
        List<Node> nodes = parser.parse(SIMPLE);

        assertThat(nodes).hasSize(3);

        Node rec = nodes.get(0);
        assertThat(rec.getName()).isEqualTo("REC");
        assertThat(rec.getLevel()).isEqualTo(1);
        assertThat(rec.getType()).isEqualTo(NodeType.RECORD);
        assertThat(rec.getPicture()).isNull();

        Node fieldA = nodes.get(1);
        assertThat(fieldA.getName()).isEqualTo("FIELD-A");
        assertThat(fieldA.getLevel()).isEqualTo(5);
        assertThat(fieldA.getType()).isEqualTo(NodeType.FIELD);
        assertThat(fieldA.getPicture().getType()).isEqualTo(PictureType.STRING);
        assertThat(fieldA.getPicture().getLength()).isEqualTo(10);

        Node fieldB = nodes.get(2);
        assertThat(fieldB.getName()).isEqualTo("FIELD-B");
        assertThat(fieldB.getLevel()).isEqualTo(5);
        assertThat(fieldB.getPicture().getType()).isEqualTo(PictureType.NUMERIC);
        assertThat(fieldB.getPicture().getLength()).isEqualTo(7);
        assertThat(fieldB.getPicture().getScale()).isEqualTo(2);
        assertThat(fieldB.getUsage()).isEqualTo(UsageType.PACKED_DECIMAL);
    }

    @Test
    void testReparseIsIdentical() {
        assertThat(parser.parse(SIMPLE)).isEqualTo(parser.parse(SIMPLE));
    }

    @Test
    void testOutputIsUnmodifiable() {
        List<Node> nodes = parser.parse(SIMPLE);

        assertThrows(UnsupportedOperationException.class, () -> nodes.remove(0));
    }

    @Test
    void testEmptyInput() {
        assertThat(parser.parse("")).isEmpty();
        assertThat(parser.parse("  EJECT  ")).isEmpty();
    }

    @Nested
    class Clauses {

        @Test
        void testRedefinesOccursAndIndexedBy() {
            List<Node> nodes = parser.parse("01 REC.\n"
                + "   05 AMOUNTS PIC 9(4) OCCURS 12 TIMES INDEXED BY AMT-IDX.\n"
                + "   05 CODES OCCURS 3.\n"
                + "   05 ALT-AMOUNTS REDEFINES AMOUNTS PIC X(48).");

            Node amounts = nodes.get(1);
            assertThat(amounts.getOccurs()).isEqualTo(12);
            assertThat(amounts.getIndexedBy()).isEqualTo("AMT-IDX");
            assertThat(amounts.getRedefines()).isNull();

            Node codes = nodes.get(2);
            assertThat(codes.getType()).isEqualTo(NodeType.RECORD);
            assertThat(codes.getOccurs()).isEqualTo(3);

            Node alt = nodes.get(3);
            assertThat(alt.getRedefines()).isEqualTo("AMOUNTS");
            assertThat(alt.getOccurs()).isEqualTo(1);
        }

        @Test
        void testUsageForms() {
            List<Node> nodes = parser.parse("01 REC.\n"
                + "   05 A PIC 9(4) BINARY.\n"
                + "   05 B PIC 9(4) USAGE IS DISPLAY.\n"
                + "   05 C PIC S9(7) COMPUTATIONAL-3.\n"
                + "   05 D PIC S9(4) comp.\n"
                + "   05 E PIC X(2).");

            assertThat(nodes.get(1).getUsage()).isEqualTo(UsageType.BINARY);
            assertThat(nodes.get(2).getUsage()).isEqualTo(UsageType.DISPLAY);
            assertThat(nodes.get(3).getUsage()).isEqualTo(UsageType.PACKED_DECIMAL);
            assertThat(nodes.get(4).getUsage()).isEqualTo(UsageType.BINARY);
            assertThat(nodes.get(5).getUsage()).isEqualTo(UsageType.NONE);
        }

        @Test
        void testValueBecomesPictureDefault() {
            List<Node> nodes = parser.parse("01 REC.\n"
                + "   05 STATUS-CD PIC X(3) VALUE 'NEW'.\n"
                + "   05 COUNTER PIC 9(3) VALUE 0 USAGE COMP-3.");

            assertThat(nodes.get(1).getPicture().getDefaultValue()).isEqualTo("NEW");
            assertThat(nodes.get(2).getPicture().getDefaultValue()).isEqualTo("0");
            assertThat(nodes.get(2).getUsage()).isEqualTo(UsageType.PACKED_DECIMAL);
        }

        @Test
        void testConditionValuesAccumulateUntilPeriod() {
            List<Node> nodes = parser.parse("01 REC.\n"
                + "   05 STATUS-CD PIC X.\n"
                + "      88 ACTIVE VALUE 'A' 'R'\n"
                + "                      'X'.\n"
                + "      88 CLOSED VALUE 'C'.\n"
                + "   05 NEXT-FIELD PIC X.");

            Node active = nodes.get(2);
            assertThat(active.getType()).isEqualTo(NodeType.ENUMERATION);
            assertThat(active.getLevel()).isEqualTo(88);
            assertThat(active.getValues()).containsExactly("A", "R", "X");

            Node closed = nodes.get(3);
            assertThat(closed.getValues()).containsExactly("C");

            assertThat(nodes.get(4).getName()).isEqualTo("NEXT-FIELD");
        }

        @Test
        void testDoubleQuotedLiterals() {
            List<Node> nodes = parser.parse("01 REC.\n"
                + "   05 TITLE PIC X(6) VALUE \"A B.C\".\n"
                + "      88 PLAIN VALUES ARE \"A B.C\" \"IT'S\".");

            assertThat(nodes.get(1).getPicture().getDefaultValue()).isEqualTo("A B.C");
            assertThat(nodes.get(2).getValues()).containsExactly("A B.C", "IT'S");
        }

        @Test
        void testGroupedDigitRunsInPicture() {
            Node node = parser.parse("01 A PIC 9(3)99.").get(0);

            assertThat(node.getType()).isEqualTo(NodeType.FIELD);
            assertThat(node.getPicture().getLength()).isEqualTo(5);
        }

        @Test
        void testUnquotedLiteralsPassThrough() {
            List<Node> nodes = parser.parse("01 REC.\n   05 LVL PIC 9.\n      88 LOW VALUE 1 2 3.");

            assertThat(nodes.get(2).getValues()).containsExactly("1", "2", "3");
        }

        @Test
        void testKeywordsAreCaseInsensitive() {
            List<Node> nodes = parser.parse("01 rec.\n   05 name pic x(4) occurs 2 times.\n   eject\n   05 amt picture is s9(3)v9.");

            assertThat(nodes).hasSize(3);
            assertThat(nodes.get(1).getOccurs()).isEqualTo(2);
            assertThat(nodes.get(2).getPicture().getScale()).isEqualTo(1);
        }
    }

    @Nested
    class Errors {

        @Test
        void testClauseKeywordWhereLevelExpected() {
            GrammarException e = assertThrows(GrammarException.class,
                () -> parser.parse("01 REC.\n   PIC X(3)."));

            assertThat(e.getLine()).isEqualTo(2);
            assertThat(e.getColumn()).isEqualTo(4);
            assertThat(e.getExpected()).isEqualTo("level number");
            assertThat(e.getActual()).isEqualTo("PIC");
        }

        @Test
        void testConflictingPictureRuns() {
            GrammarException e = assertThrows(GrammarException.class,
                () -> parser.parse("01 REC.\n   05 BAD PIC X(3)9(2)."));

            assertThat(e.getLine()).isEqualTo(2);
            assertThat(e.getColumn()).isEqualTo(15);
            assertThat(e.getExpected()).isEqualTo("PICTURE definition");
        }

        @Test
        void testOversizedRepeatCount() {
            GrammarException e = assertThrows(GrammarException.class,
                () -> parser.parse("01 A PIC X(99999999999)."));

            assertThat(e.getExpected()).isEqualTo("PICTURE definition");
            assertThat(e.getColumn()).isEqualTo(10);
        }

        @Test
        void testValueWithoutPictureOutsideConditionLevel() {
            assertThrows(GrammarException.class, () -> parser.parse("01 REC VALUE 'X'."));
        }

        @Test
        void testUnknownUsage() {
            assertThrows(GrammarException.class, () -> parser.parse("01 A PIC 9 USAGE FLOAT."));
        }

        @Test
        void testMissingIdentifier() {
            assertThrows(GrammarException.class, () -> parser.parse("01 ."));
        }

        @Test
        void testUnknownClause() {
            GrammarException e = assertThrows(GrammarException.class,
                () -> parser.parse("01 REC SYNCHRONIZED."));

            assertThat(e.getExpected()).isEqualTo("clause");
        }

        @Test
        void testOccursDependingOnIsRejected() {
            assertThrows(GrammarException.class,
                () -> parser.parse("01 REC.\n   05 ITEMS PIC X OCCURS 10 TIMES DEPENDING ON CNT."));
        }

        @Test
        void testOccursNeedsPositiveCount() {
            assertThrows(GrammarException.class, () -> parser.parse("01 A PIC X OCCURS 0."));
            assertThrows(GrammarException.class, () -> parser.parse("01 A PIC X OCCURS MANY."));
        }

        @Test
        void testLevelOutOfRange() {
            assertThrows(GrammarException.class, () -> parser.parse("00 A."));
            assertThrows(GrammarException.class, () -> parser.parse("100 A."));
        }

        @Test
        void testMissingFinalPeriod() {
            GrammarException e = assertThrows(GrammarException.class,
                () -> parser.parse("01 REC.\n   05 A PIC X"));

            assertThat(e.getActual()).isEqualTo("(eof)");
        }

        @Test
        void testConditionValuesRunningIntoEof() {
            assertThrows(GrammarException.class, () -> parser.parse("88 FLAG VALUE 'Y' 'N'"));
        }

        @Test
        void testTokenizationErrorsShareBaseType() {
            assertThrows(CopybookException.class, () -> parser.parse("01 REC VALUE 'OPEN."));
        }
    }
}
