package org.pidstandard.catalog.tagging;

import org.junit.jupiter.api.Test;
import org.pidstandard.catalog.model.TaggingMode;

import static org.assertj.core.api.Assertions.assertThat;

class TagPatternEngineTest {

    private final TypeCodeLookup lookup = TypeCodeLookup.defaults();

    @Test
    void expand_padsSequenceToMaskWidth() {
        ExpansionContext ctx = new ExpansionContext("P", "A01");
        assertThat(TagPatternEngine.expand("{SEQ:000}", ctx, 7)).isEqualTo("007");
        assertThat(TagPatternEngine.expand("P-{SEQ:001}", ctx, 10)).isEqualTo("P-010");
        assertThat(TagPatternEngine.expand("P-{SEQ:0000}", ctx, 42)).isEqualTo("P-0042");
    }

    @Test
    void expand_neverTruncatesWiderNumbers() {
        ExpansionContext ctx = new ExpansionContext("P", "A01");
        assertThat(TagPatternEngine.expand("{SEQ:000}", ctx, 12345)).isEqualTo("12345");
    }

    @Test
    void expand_resolvesAreaAndTypeCode() {
        ExpansionContext ctx = ExpansionContext.of("Pump", "A01", lookup);
        assertThat(TagPatternEngine.expand("{AREA}-{TYPE}-{SEQ:000}", ctx, 1)).isEqualTo("A01-P-001");
    }

    @Test
    void expand_usesDefaultAreaWhenMissing() {
        assertThat(TagPatternEngine.expand("{AREA}-{TYPE}", ExpansionContext.of("Tank", null, lookup), 1)).isEqualTo("00-T");
        assertThat(TagPatternEngine.expand("{AREA}-{TYPE}", ExpansionContext.of("Tank", "", lookup), 1)).isEqualTo("00-T");
    }

    @Test
    void expand_plainSeqHasNoPadding() {
        assertThat(TagPatternEngine.expand("V{SEQ}", new ExpansionContext("V", "A"), 3)).isEqualTo("V3");
    }

    @Test
    void expand_keepsUnknownPlaceholdersVerbatim() {
        ExpansionContext ctx = new ExpansionContext("P", "A01");
        assertThat(TagPatternEngine.expand("{FOO}-{SEQ:abc}-{SEQ}", ctx, 5)).isEqualTo("{FOO}-{SEQ:abc}-5");
    }

    @Test
    void expand_doesNotReExpandSubstitutedText() {
        // 区域本身长得像占位符时按字面输出
        ExpansionContext ctx = new ExpansionContext("{AREA}", "{TYPE}");
        assertThat(TagPatternEngine.expand("{TYPE}/{AREA}", ctx, 1)).isEqualTo("{AREA}/{TYPE}");
        assertThat(TagPatternEngine.expand("{AREA}/{TYPE}", ctx, 1)).isEqualTo("{TYPE}/{AREA}");
    }

    @Test
    void expand_keepsSignOfNegativeNumbers() {
        ExpansionContext ctx = new ExpansionContext("P", "A01");
        assertThat(TagPatternEngine.expand("{SEQ:000}", ctx, -7)).isEqualTo("-007");
        assertThat(TagPatternEngine.expand("{SEQ}", ctx, -7)).isEqualTo("-7");
        assertThat(TagPatternEngine.expand("{SEQ:000}", ctx, Integer.MIN_VALUE)).isEqualTo("-2147483648");
    }

    @Test
    void expand_isDeterministic() {
        ExpansionContext ctx = ExpansionContext.of("Heat Exchanger", "B2", lookup);
        String first = TagPatternEngine.expand("{AREA}-{TYPE}-{SEQ:000}", ctx, 9);
        String second = TagPatternEngine.expand("{AREA}-{TYPE}-{SEQ:000}", ctx, 9);
        assertThat(first).isEqualTo("B2-HX-009").isEqualTo(second);
    }

    @Test
    void expand_emptyPatternGivesEmptyTag() {
        assertThat(TagPatternEngine.expand("", new ExpansionContext("P", "A"), 1)).isEmpty();
    }

    @Test
    void example_usesSampleContext() {
        assertThat(TagPatternEngine.example("{TYPE}-{AREA}-{SEQ:000}")).isEqualTo("PMP-A01-001");
    }

    @Test
    void defaultPattern_dependsOnTaggingMode() {
        assertThat(TagPatternEngine.defaultPattern(TaggingMode.KKS)).isEqualTo("={AREA}-{TYPE}-{SEQ:000}");
        assertThat(TagPatternEngine.defaultPattern(TaggingMode.CUSTOM)).isEqualTo("{TYPE}-{SEQ:001}");
    }
}
