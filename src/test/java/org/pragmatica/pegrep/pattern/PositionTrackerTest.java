package org.pragmatica.pegrep.pattern;

import org.junit.jupiter.api.Test;
import org.pragmatica.pegrep.tree.SourceLocation;

import static org.junit.jupiter.api.Assertions.*;

class PositionTrackerTest {

    @Test
    void write_tracksLineAndColumn() {
        var tracker = new PositionTracker();

        tracker.write("ab\ncd");

        assertEquals(SourceLocation.at(2, 3, 5), tracker.location());
        assertEquals("ab\ncd", tracker.text());
    }

    @Test
    void substitute_sameLength_recordsNothing() {
        var tracker = new PositionTracker();

        tracker.substitute("xy", 2);

        assertTrue(tracker.offsets().isEmpty());
    }

    @Test
    void correct_afterSubstitution_subtractsLength() {
        var tracker = new PositionTracker();
        tracker.write("ab ");
        tracker.substitute("$$0", 2);
        tracker.write(" + )");

        var corrected = tracker.correct(SourceLocation.at(1, 10, 9));

        assertEquals(SourceLocation.at(1, 9, 8), corrected);
    }

    @Test
    void correct_beforeSubstitution_isUnchanged() {
        var tracker = new PositionTracker();
        tracker.write("ab ");
        tracker.substitute("$$0", 2);

        assertEquals(SourceLocation.at(1, 2, 1), tracker.correct(SourceLocation.at(1, 2, 1)));
        assertEquals(SourceLocation.at(1, 4, 3), tracker.correct(SourceLocation.at(1, 4, 3)));
    }

    @Test
    void correct_laterLine_fixesOffsetOnly() {
        var tracker = new PositionTracker();
        tracker.substitute("$$0", 2);
        tracker.write("\n)");

        assertEquals(SourceLocation.at(2, 1, 3), tracker.correct(SourceLocation.at(2, 1, 4)));
    }

    @Test
    void correct_shorterEncoding_addsLengthBack() {
        var tracker = new PositionTracker();
        tracker.write("f(");
        tracker.substitute("$$0", 6);
        tracker.write(", ])");

        // ']' sits at column 8 of "f($$0, ])" and column 11 of "f($*rest, ])"
        assertEquals(SourceLocation.at(1, 11, 10), tracker.correct(SourceLocation.at(1, 8, 7)));
    }

    @Test
    void correct_multipleSubstitutions_accumulate() {
        var tracker = new PositionTracker();
        tracker.substitute("$$0", 2);
        tracker.write(" + ");
        tracker.substitute("$$1", 2);
        tracker.write(" )");

        // "$$0 + $$1 )" against "$a + $b )"
        assertEquals(SourceLocation.at(1, 9, 8), tracker.correct(SourceLocation.at(1, 11, 10)));
        assertEquals(SourceLocation.at(1, 6, 5), tracker.correct(SourceLocation.at(1, 7, 6)));
    }
}
