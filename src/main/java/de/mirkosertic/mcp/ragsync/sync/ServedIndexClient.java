package de.mirkosertic.mcp.ragsync.sync;

import java.io.IOException;
import java.util.List;

/**
 * Access to a downstream index that serves a copy of the local documents.
 */
public interface ServedIndexClient {

    /**
     * Document count the downstream index reports about itself.
     */
    long reportedDocumentCount() throws IOException;

    /**
     * Documents the downstream index actually returns when listing.
     */
    List<ServedDocument> listDocuments() throws IOException;

    void deleteDocument(String id) throws IOException;
}
