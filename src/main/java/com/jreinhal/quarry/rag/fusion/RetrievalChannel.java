package com.jreinhal.quarry.rag.fusion;

import com.jreinhal.quarry.model.ScoreComponent;

public enum RetrievalChannel {
    SHORT(ScoreComponent.SHORT, true),
    TITLE(ScoreComponent.TITLE, true),
    LEXICAL(ScoreComponent.LEXICAL, true),
    VECTOR(ScoreComponent.VECTOR, false);

    private final ScoreComponent component;
    private final boolean lexicalGroup;

    private RetrievalChannel(ScoreComponent component, boolean lexicalGroup) {
        this.component = component;
        this.lexicalGroup = lexicalGroup;
    }

    public ScoreComponent getComponent() {
        return this.component;
    }

    public boolean isLexicalGroup() {
        return this.lexicalGroup;
    }
}
