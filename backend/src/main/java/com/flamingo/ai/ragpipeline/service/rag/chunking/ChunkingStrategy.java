package com.flamingo.ai.ragpipeline.service.rag.chunking;

/** How parsed text is cut into chunks. */
public enum ChunkingStrategy {
  /** Blank-line separated paragraphs packed up to the chunk size. */
  PARAGRAPHS,

  /** Sentences packed up to the chunk size. */
  SENTENCES,

  /** Sections opened by headings, each chunked by paragraphs and tagged with its heading. */
  HEADINGS,

  /** Sentences grouped while adjacent sentences stay lexically similar. */
  SEMANTIC,

  /** Fixed-size character windows. */
  CHARACTERS
}
