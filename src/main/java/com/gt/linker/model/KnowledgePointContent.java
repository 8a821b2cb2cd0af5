package com.gt.linker.model;

public record KnowledgePointContent(String category,
                                    String subcategory,
                                    String correctPhrase,
                                    String explanation,
                                    String userContextSentence,
                                    String incorrectPhraseInContext,
                                    String keyPointSummary) { }
