package de.mirkosertic.mcp.ragsync.store;

/**
 * Thrown when an operation addresses a document id that is not stored.
 */
public class DocumentNotFoundException extends StoreException {

    private final String documentId;

    public DocumentNotFoundException(final String documentId) {
        super("Document " + documentId + " not found");
        this.documentId = documentId;
    }

    public String getDocumentId() {
        return documentId;
    }
}
