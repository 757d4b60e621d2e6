package com.gt.wordreminder.model;

public record RevealedAnswer(String prompt, String answer) { }
