package com.gt.wordreminder.model;

public record CardContent(String front, String back) { }
