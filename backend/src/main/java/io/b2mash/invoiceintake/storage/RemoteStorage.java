package io.b2mash.invoiceintake.storage;

import java.util.List;

/**
 * Abstraction for the remote destination of converted invoices. Domain services inject this
 * interface instead of vendor-specific clients.
 *
 * <p>System-wide: selected via {@code intake.storage.provider}.
 */
public interface RemoteStorage {

  /**
   * Upload {@code files} into the folder {@code folderName} under {@code destinationParentId}.
   * Idempotent: uploading to the same folder name again reuses the folder and overwrites files of
   * the same name instead of creating duplicates.
   *
   * @return the id of the destination folder
   */
  String uploadFolder(List<OutputFile> files, String destinationParentId, String folderName);

  /** Names of the folders directly under {@code destinationParentId}. */
  List<String> listFolders(String destinationParentId);
}
