package com.gentoro.endnotemcp.facade;

public record ErrorRecord(String error) implements PaperResult {}
