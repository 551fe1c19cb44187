package io.b2mash.invoiceintake.testutil;

import io.b2mash.invoiceintake.storage.OutputFile;
import io.b2mash.invoiceintake.storage.RemoteStorage;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/** Folder-per-prefix storage that overwrites files in place, like the S3 adapter. */
public class InMemoryRemoteStorage implements RemoteStorage {

  private final Map<String, Map<String, Map<String, byte[]>>> foldersByParent =
      new LinkedHashMap<>();

  public final AtomicInteger uploadCalls = new AtomicInteger();

  @Override
  public synchronized String uploadFolder(
      List<OutputFile> files, String destinationParentId, String folderName) {
    uploadCalls.incrementAndGet();
    Map<String, byte[]> folder =
        foldersByParent
            .computeIfAbsent(destinationParentId, parent -> new LinkedHashMap<>())
            .computeIfAbsent(folderName, name -> new LinkedHashMap<>());
    for (OutputFile file : files) {
      folder.put(file.name(), file.content());
    }
    return destinationParentId + "/" + folderName + "/";
  }

  @Override
  public synchronized List<String> listFolders(String destinationParentId) {
    return new ArrayList<>(foldersByParent.getOrDefault(destinationParentId, Map.of()).keySet());
  }

  public synchronized List<String> fileNames(String destinationParentId, String folderName) {
    return new ArrayList<>(
        foldersByParent
            .getOrDefault(destinationParentId, Map.of())
            .getOrDefault(folderName, Map.of())
            .keySet());
  }
}
