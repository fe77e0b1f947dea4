package tw.gc.auto.strategylab.config;

import java.util.Locale;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.dataformat.yaml.util.StringQuotingChecker;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Mapper factories shared by the Spring context and plain unit tests.
 *
 * <p>Metrics may be NaN or infinite, so the JSON mapper reads non-numeric numbers back.
 */
public final class JsonMappers {

    private JsonMappers() {
    }

    public static ObjectMapper json() {
        return JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    }

    /**
     * YAML mapper that quotes every string a YAML reader could take for a number or boolean,
     * so a written document parses back to the same values.
     */
    public static YAMLMapper yaml() {
        YAMLFactory factory = YAMLFactory.builder()
            .stringQuotingChecker(new NumberLikeQuotingChecker())
            .build();
        return YAMLMapper.builder(factory)
            .addModule(new JavaTimeModule())
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    }

    /**
     * Adds hex, underscored and other digit-led strings, plus {@code .inf}/{@code .nan}, to the
     * reserved words the default checker already quotes.
     */
    static final class NumberLikeQuotingChecker extends StringQuotingChecker.Default {

        private static final long serialVersionUID = 1L;

        @Override
        public boolean needToQuoteValue(String value) {
            return super.needToQuoteValue(value) || looksNumeric(value);
        }

        static boolean looksNumeric(String value) {
            int i = 0;
            if (i < value.length() && (value.charAt(i) == '-' || value.charAt(i) == '+')) {
                i++;
            }
            String rest = value.substring(i).toLowerCase(Locale.ROOT);
            if (rest.equals(".inf") || rest.equals(".nan")) {
                return true;
            }
            if (rest.startsWith(".")) {
                rest = rest.substring(1);
            }
            return !rest.isEmpty() && Character.isDigit(rest.charAt(0));
        }
    }
}
