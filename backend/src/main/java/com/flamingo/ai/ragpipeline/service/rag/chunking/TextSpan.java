package com.flamingo.ai.ragpipeline.service.rag.chunking;

/**
 * A chunk of text cut by {@link TextChunker}.
 *
 * @param text the chunk text
 * @param section heading of the enclosing section, or null
 */
public record TextSpan(String text, String section) {}
