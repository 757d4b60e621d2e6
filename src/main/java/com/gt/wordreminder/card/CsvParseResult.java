package com.gt.wordreminder.card;

import com.gt.wordreminder.model.CardContent;

import java.util.List;

public record CsvParseResult(List<CardContent> accepted, List<String> rejectedRows) { }
