package de.mirkosertic.nlpquery;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import de.mirkosertic.nlpquery.config.ApplicationConfig;
import de.mirkosertic.nlpquery.config.LoggingConfigurator;
import de.mirkosertic.nlpquery.search.DocumentSearchBackend;
import de.mirkosertic.nlpquery.search.SpeechRecognizer;
import de.mirkosertic.nlpquery.search.VoiceRecognitionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Command line host of the query pipeline. Processes the query given as arguments against a
 * search backend without documents and prints the result as JSON.
 * <p>
 * Usage: {@code NlpQueryApplication [--lang=en|ar] [--user=<id>] [--voice] <query words...>}
 */
public class NlpQueryApplication {

    private static final Logger logger = LoggerFactory.getLogger(NlpQueryApplication.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    record Arguments(Language language, String userId, boolean voice, String query) {

        static Arguments parse(final String[] args, final Language defaultLanguage) {
            Language language = defaultLanguage;
            String userId = null;
            boolean voice = false;
            final List<String> words = new ArrayList<>();
            for (final String arg : args) {
                if (arg.startsWith("--lang=")) {
                    language = Language.queryLanguage(arg.substring("--lang=".length()));
                } else if (arg.startsWith("--user=")) {
                    userId = arg.substring("--user=".length());
                } else if ("--voice".equals(arg)) {
                    voice = true;
                } else {
                    words.add(arg);
                }
            }
            return new Arguments(language, userId, voice, String.join(" ", words));
        }

        ProcessingOptions toOptions() {
            final ProcessingOptions options = ProcessingOptions.defaults().withLanguage(language);
            return userId == null ? options : options.withUserId(userId);
        }
    }

    /**
     * Accepts every non-blank transcription as recognized.
     */
    static SpeechRecognizer transcriptRecognizer() {
        return text -> {
            final boolean recognized = text != null && !text.isBlank();
            return new VoiceRecognitionResult(recognized, recognized ? 1.0 : 0.0,
                    recognized ? Map.of("transcript", text.trim()) : Map.of(), List.of());
        };
    }

    public static void main(final String[] args) {
        NlpQueryPipeline pipeline = null;
        try {
            final ApplicationConfig config = ApplicationConfig.load();
            LoggingConfigurator.applyDebugMode(config.isDebugMode());

            final Arguments arguments = Arguments.parse(args, config.getDefaultLanguage());
            if (arguments.query().isBlank()) {
                System.err.println("Usage: NlpQueryApplication [--lang=en|ar] [--user=<id>] [--voice] <query words...>");
                System.exit(2);
                return;
            }

            pipeline = NlpQueryPipeline.create(config, DocumentSearchBackend.empty(), transcriptRecognizer());
            logger.info("Processing '{}' ({})", arguments.query(), arguments.language().code());

            final Object result = arguments.voice()
                    ? pipeline.processVoiceQuery(arguments.query(), arguments.toOptions())
                    : pipeline.processQuery(arguments.query(), arguments.toOptions());
            System.out.println(OBJECT_MAPPER.writeValueAsString(result));
        } catch (final Exception e) {
            System.err.println("Failed to process query: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        } finally {
            if (pipeline != null) {
                pipeline.shutdown();
            }
        }
    }
}
