package com.gentoro.endnotemcp.facade;

/** Response of {@code read_paper}: either {@link PaperContent} or {@link ErrorRecord}. */
public interface PaperResult {}
