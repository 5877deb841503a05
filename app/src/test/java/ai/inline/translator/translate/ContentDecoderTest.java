package ai.inline.translator.translate;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class ContentDecoderTest {

    private final ContentDecoder decoder = new ContentDecoder(new ObjectMapper());

    @Test
    void decodesFencedJsonWithShortKeys() {
        ContentDecoder.DecodedContent decoded = decoder.decode("Sure! ```json\n{\"t\":\"你好\",\"r\":\"nǐ hǎo\"}\n```");

        assertThat(decoded.source()).isEqualTo(ContentDecoder.Source.STRUCTURED);
        assertThat(decoded.payload().translation()).isEqualTo("你好");
        assertThat(decoded.payload().romanized()).isEqualTo("nǐ hǎo");
    }

    @Test
    void acceptsLongFormKeys() {
        ContentDecoder.DecodedContent decoded = decoder.decode(
                "{\"translation\":\"good morning\",\"alternatives\":[\"morning\"],\"romanized\":null}");

        assertThat(decoded.source()).isEqualTo(ContentDecoder.Source.STRUCTURED);
        assertThat(decoded.payload().translation()).isEqualTo("good morning");
        assertThat(decoded.payload().alternatives()).containsExactly("morning");
        assertThat(decoded.payload().romanized()).isNull();
    }

    @Test
    void ignoresUnknownKeys() {
        ContentDecoder.DecodedContent decoded = decoder.decode("{\"t\":\"hi\",\"confidence\":0.9}");

        assertThat(decoded.source()).isEqualTo(ContentDecoder.Source.STRUCTURED);
        assertThat(decoded.payload().translation()).isEqualTo("hi");
    }

    @Test
    void twoObjectsInOneReplyFallBackToRawText() {
        String content = "{\"t\":\"first\"} or alternatively {\"t\":\"second\"}";

        ContentDecoder.DecodedContent decoded = decoder.decode(content);

        assertThat(decoded.source()).isEqualTo(ContentDecoder.Source.RAW_FALLBACK);
        assertThat(decoded.payload().translation()).isEqualTo(content);
    }

    @Test
    void numericTranslationIsNotText() {
        ContentDecoder.DecodedContent decoded = decoder.decode("{\"t\":42}");

        assertThat(decoded.source()).isEqualTo(ContentDecoder.Source.RAW_FALLBACK);
        assertThat(decoded.payload().translation()).isEqualTo("{\"t\":42}");
    }

    @Test
    void booleanRomanizationIsNotText() {
        ContentDecoder.DecodedContent decoded = decoder.decode("{\"t\":\"hi\",\"r\":true}");

        assertThat(decoded.source()).isEqualTo(ContentDecoder.Source.RAW_FALLBACK);
    }

    @Test
    void plainProseFallsBackToRawText() {
        ContentDecoder.DecodedContent decoded = decoder.decode("  I cannot translate that.  ");

        assertThat(decoded.source()).isEqualTo(ContentDecoder.Source.RAW_FALLBACK);
        assertThat(decoded.payload().translation()).isEqualTo("I cannot translate that.");
        assertThat(decoded.payload().romanized()).isNull();
        assertThat(decoded.payload().alternatives()).isNull();
    }

    @Test
    void brokenJsonFallsBackToWholeContent() {
        String content = "Here you go: {\"t\": \"unterminated}";

        ContentDecoder.DecodedContent decoded = decoder.decode(content);

        assertThat(decoded.source()).isEqualTo(ContentDecoder.Source.RAW_FALLBACK);
        assertThat(decoded.payload().translation()).isEqualTo(content);
    }

    @Test
    void objectWithoutTranslationFallsBack() {
        ContentDecoder.DecodedContent decoded = decoder.decode("{\"r\":\"ni hao\"}");

        assertThat(decoded.source()).isEqualTo(ContentDecoder.Source.RAW_FALLBACK);
        assertThat(decoded.payload().translation()).isEqualTo("{\"r\":\"ni hao\"}");
    }

    @Test
    void candidateSpansFirstOpenToLastCloseBrace() {
        assertThat(ContentDecoder.extractCandidate("x {\"a\":{\"b\":1}} y")).isEqualTo("{\"a\":{\"b\":1}}");
        assertThat(ContentDecoder.extractCandidate("no braces")).isEqualTo("no braces");
        assertThat(ContentDecoder.extractCandidate("} reversed {")).isEqualTo("} reversed {");
    }
}
