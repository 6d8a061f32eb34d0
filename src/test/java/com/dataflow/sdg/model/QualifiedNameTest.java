package com.dataflow.sdg.model;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class QualifiedNameTest {

    @Test
    public void testCanonicalFormsRoundTrip() {
        for (String spec : List.of("reco:tracker/hits", "tracker/hits", "hits"))
            assertEquals(spec, QualifiedName.create(spec).full());
    }

    @Test
    public void testCreateSplitsQualifierAndName() {
        QualifiedName name = QualifiedName.create("reco:tracker/hits");
        assertEquals("reco", name.plugin());
        assertEquals("tracker", name.algorithm());
        assertEquals("hits", name.name());
    }

    @Test(expected = NameParseException.class)
    public void testEmptyProductNameRejected() {
        QualifiedName.create("tracker/");
    }

    @Test
    public void testToQualifiedNamesUsesOneProducer() {
        AlgorithmName producer = AlgorithmName.create("reco:tracker");
        List<QualifiedName> names = QualifiedName.toQualifiedNames(producer, List.of("hits", "tracks"));
        assertEquals(2, names.size());
        assertEquals("reco:tracker/hits", names.get(0).full());
        assertEquals("reco:tracker/tracks", names.get(1).full());
    }

    @Test
    public void testOrderingComposesQualifierThenName() {
        QualifiedName a = QualifiedName.create("a:x/z");
        QualifiedName b = QualifiedName.create("b:x/a");
        QualifiedName c = QualifiedName.create("a:x/a");
        assertTrue(a.compareTo(b) < 0);
        assertTrue(c.compareTo(a) < 0);
    }

    @Test
    public void testUnqualifiedLabelMatchesAnyProducer() {
        Label label = Label.create("hits");
        assertFalse(label.isQualified());
        assertTrue(label.matches(QualifiedName.create("reco:tracker/hits")));
        assertTrue(label.matches(QualifiedName.create("hits")));
        assertFalse(label.matches(QualifiedName.create("reco:tracker/tracks")));
    }

    @Test
    public void testQualifiedLabelMatchesOnlyItsProducer() {
        Label label = Label.create("tracker/hits");
        assertTrue(label.isQualified());
        assertTrue(label.matches(QualifiedName.create("reco:tracker/hits")));
        assertFalse(label.matches(QualifiedName.create("reco:fitter/hits")));
        assertTrue(Label.create("reco:tracker/hits").matches(QualifiedName.create("reco:tracker/hits")));
        assertFalse(Label.create("sim:tracker/hits").matches(QualifiedName.create("reco:tracker/hits")));
    }
}
