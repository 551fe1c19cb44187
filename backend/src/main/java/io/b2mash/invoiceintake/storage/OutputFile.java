package io.b2mash.invoiceintake.storage;

/** A generated artifact ready for upload. */
public record OutputFile(String name, byte[] content, String contentType) {}
