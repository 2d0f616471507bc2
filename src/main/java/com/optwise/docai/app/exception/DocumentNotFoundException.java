package com.optwise.docai.app.exception;

public class DocumentNotFoundException extends DocumentProcessingException {

  public DocumentNotFoundException(String documentId) {
    super("DOCUMENT_NOT_FOUND", "Document " + documentId + " not found");
  }
}
