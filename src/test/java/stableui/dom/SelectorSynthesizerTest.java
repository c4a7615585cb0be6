package stableui.dom;

import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class SelectorSynthesizerTest {

    @Test
    public void isStableClass_rejectsGeneratedAndStateClasses() {
        assertThat(SelectorSynthesizer.isStableClass("checkout")).isTrue();
        assertThat(SelectorSynthesizer.isStableClass("primaryButton")).isTrue();
        assertThat(SelectorSynthesizer.isStableClass("css-1x2y3z")).isFalse();
        assertThat(SelectorSynthesizer.isStableClass("sc-bdVaJa")).isFalse();
        assertThat(SelectorSynthesizer.isStableClass("item-12345")).isFalse();
        assertThat(SelectorSynthesizer.isStableClass("a1b2c3")).isFalse();
        assertThat(SelectorSynthesizer.isStableClass("active")).isFalse();
        assertThat(SelectorSynthesizer.isStableClass("is-open")).isFalse();
    }

    @Test
    public void isXPath_detectsLeadingSlashOrParen() {
        assertThat(SelectorSynthesizer.isXPath("//button")).isTrue();
        assertThat(SelectorSynthesizer.isXPath("(//a)[2]")).isTrue();
        assertThat(SelectorSynthesizer.isXPath("#login")).isFalse();
    }

    @Test
    public void synthesize_quotesIdsThatAreNotCssIdentifiers() {
        ElementIndex index = new ElementIndexer().index("<body><button id=\"1st:go\">Go</button></body>");

        assertThat(index.elements().get(0).selector()).isEqualTo("button[id=\"1st:go\"]");
    }
}
