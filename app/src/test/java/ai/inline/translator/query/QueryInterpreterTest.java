package ai.inline.translator.query;

import static org.assertj.core.api.Assertions.assertThat;

import ai.inline.translator.language.LanguageCode;
import ai.inline.translator.language.LanguageGuesser;
import ai.inline.translator.language.LinguaLanguageGuesser;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class QueryInterpreterTest {

    private static final LanguageGuesser UNKNOWN = text -> Optional.empty();

    private final QueryInterpreter interpreter = new QueryInterpreter(UNKNOWN);

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "en>zh: good morning;EN;ZH",
            "EN>ZH good morning;EN;ZH",
            "zh->en: good morning;ZH;EN",
            "Zh -> En good morning;ZH;EN",
            "en -> zh: good morning;EN;ZH",
            "  zh > en :good morning;ZH;EN"
    })
    void explicitPrefixSetsDirectionAndIsRemoved(String raw, LanguageCode source, LanguageCode target) {
        ParsedQuery query = interpreter.interpret(raw, LanguageCode.EN, LanguageCode.ZH).orElseThrow();

        assertThat(query.sourceLang()).isEqualTo(source);
        assertThat(query.targetLang()).isEqualTo(target);
        assertThat(query.text()).isEqualTo("good morning");
    }

    @Test
    void prefixOverridesScriptDetection() {
        ParsedQuery query = interpreter.interpret("en>zh: 你好", LanguageCode.EN, LanguageCode.ZH).orElseThrow();

        assertThat(query.sourceLang()).isEqualTo(LanguageCode.EN);
        assertThat(query.targetLang()).isEqualTo(LanguageCode.ZH);
        assertThat(query.text()).isEqualTo("你好");
    }

    @Test
    void chineseCharactersMeanChineseToEnglish() {
        ParsedQuery query = interpreter.interpret("开会推迟到几点?", LanguageCode.EN, LanguageCode.ZH).orElseThrow();

        assertThat(query.sourceLang()).isEqualTo(LanguageCode.ZH);
        assertThat(query.targetLang()).isEqualTo(LanguageCode.EN);
        assertThat(query.text()).isEqualTo("开会推迟到几点?");
    }

    @Test
    void cjkCheckRunsBeforeStatisticalGuess() {
        List<String> guessed = new ArrayList<>();
        QueryInterpreter recording = new QueryInterpreter(text -> {
            guessed.add(text);
            return Optional.of(LanguageCode.EN);
        });

        ParsedQuery query = recording.interpret("meeting 会议", LanguageCode.EN, LanguageCode.ZH).orElseThrow();

        assertThat(query.sourceLang()).isEqualTo(LanguageCode.ZH);
        assertThat(guessed).isEmpty();
    }

    @Test
    void englishGuessMeansEnglishToChinese() {
        QueryInterpreter english = new QueryInterpreter(text -> Optional.of(LanguageCode.EN));

        ParsedQuery query = english.interpret("hello world", LanguageCode.ZH, LanguageCode.EN).orElseThrow();

        assertThat(query.sourceLang()).isEqualTo(LanguageCode.EN);
        assertThat(query.targetLang()).isEqualTo(LanguageCode.ZH);
    }

    @Test
    void chineseGuessMeansChineseToEnglish() {
        QueryInterpreter chinese = new QueryInterpreter(text -> Optional.of(LanguageCode.ZH));

        ParsedQuery query = chinese.interpret("ni hao", LanguageCode.EN, LanguageCode.ZH).orElseThrow();

        assertThat(query.sourceLang()).isEqualTo(LanguageCode.ZH);
        assertThat(query.targetLang()).isEqualTo(LanguageCode.EN);
    }

    @Test
    void latinLettersFallBackToEnglishToChinese() {
        ParsedQuery query = interpreter.interpret("hello world", LanguageCode.ZH, LanguageCode.EN).orElseThrow();

        assertThat(query.sourceLang()).isEqualTo(LanguageCode.EN);
        assertThat(query.targetLang()).isEqualTo(LanguageCode.ZH);
        assertThat(query.text()).isEqualTo("hello world");
    }

    @Test
    void noLettersUsesConfiguredDefaults() {
        ParsedQuery query = interpreter.interpret("12:30 → 14:00", LanguageCode.ZH, LanguageCode.EN).orElseThrow();

        assertThat(query.sourceLang()).isEqualTo(LanguageCode.ZH);
        assertThat(query.targetLang()).isEqualTo(LanguageCode.EN);
    }

    @Test
    void blankInputYieldsNothing() {
        assertThat(interpreter.interpret("   ", LanguageCode.EN, LanguageCode.ZH)).isEmpty();
        assertThat(interpreter.interpret(null, LanguageCode.EN, LanguageCode.ZH)).isEmpty();
    }

    @Test
    void noBreakSpacesAreTrimmed() {
        assertThat(interpreter.interpret("\u00A0\u2007\u202F", LanguageCode.EN, LanguageCode.ZH)).isEmpty();

        ParsedQuery query = interpreter.interpret("\u00A0en>zh:\u00A0hello | \u00A0world\u00A0",
                LanguageCode.ZH, LanguageCode.EN).orElseThrow();

        assertThat(query.text()).isEqualTo("hello|world");
        assertThat(query.sourceLang()).isEqualTo(LanguageCode.EN);
    }

    @Test
    void shortEnglishWithLinguaIsEnglishToChinese() {
        QueryInterpreter lingua = new QueryInterpreter(new LinguaLanguageGuesser());

        ParsedQuery query = lingua.interpret("hello world", LanguageCode.ZH, LanguageCode.EN).orElseThrow();

        assertThat(query.sourceLang()).isEqualTo(LanguageCode.EN);
        assertThat(query.targetLang()).isEqualTo(LanguageCode.ZH);
        assertThat(query.text()).isEqualTo("hello world");
    }

    @Test
    void delimitersOnlyYieldNothing() {
        assertThat(interpreter.interpret(" | | ", LanguageCode.EN, LanguageCode.ZH)).isEmpty();
    }

    @Test
    void prefixWithoutTextYieldsNothing() {
        assertThat(interpreter.interpret("en>zh:", LanguageCode.EN, LanguageCode.ZH)).isEmpty();
    }

    @Test
    void segmentsAreNormalized() {
        ParsedQuery query = interpreter.interpret("en>zh: sustainability roadmap |  | 2025 goals ",
                LanguageCode.EN, LanguageCode.ZH).orElseThrow();

        assertThat(query.text()).isEqualTo("sustainability roadmap|2025 goals");
    }

    @Test
    void longTextIsTruncated() {
        String raw = "x".repeat(SegmentNormalizer.MAX_TEXT_LENGTH + 500);

        ParsedQuery query = interpreter.interpret(raw, LanguageCode.EN, LanguageCode.ZH).orElseThrow();

        assertThat(query.text()).hasSize(SegmentNormalizer.MAX_TEXT_LENGTH);
    }
}
