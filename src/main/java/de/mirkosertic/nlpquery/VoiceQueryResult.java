package de.mirkosertic.nlpquery;

import de.mirkosertic.nlpquery.search.VoiceRecognitionResult;

/**
 * A voice query: the speech recognizer's verdict and the pipeline result for the transcribed text.
 */
public record VoiceQueryResult(VoiceRecognitionResult voiceResult, NlpProcessingResult result) {
}
