package com.gt.wordreminder.model;

public record ExportedFile(String fileName, byte[] content, int cardCount) { }
