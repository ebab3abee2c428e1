package com.github.salilvnair.convrouter.intent;

import com.github.salilvnair.convrouter.session.IntentContext;

public interface IntentClassifier {

    /**
     * Classifies {@code text} into its single most likely intent.
     *
     * @param context optional session; only read, never modified
     */
    Intent classify(String text, IntentContext context);

    MultiIntentResult classifyMulti(String text, IntentContext context);
}
