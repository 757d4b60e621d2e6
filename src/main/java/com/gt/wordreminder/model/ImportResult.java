package com.gt.wordreminder.model;

import java.util.List;

public record ImportResult(int inserted, int updated, List<String> rejectedRows) { }
