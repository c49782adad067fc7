package de.mirkosertic.nlpquery.search;

/**
 * Speech-to-text collaborator used by the voice query path.
 */
@FunctionalInterface
public interface SpeechRecognizer {

    /**
     * Interpret a transcribed utterance.
     *
     * @param text the transcribed text
     * @return the recognition outcome, consumed verbatim by the pipeline
     */
    VoiceRecognitionResult processVoiceInput(String text);
}
