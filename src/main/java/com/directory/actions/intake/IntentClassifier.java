package com.directory.actions.intake;

/**
 * Turns operator text into an intent plus the parts needed to act on it.
 */
@FunctionalInterface
public interface IntentClassifier {

    ClassifiedText classify(String text);
}
