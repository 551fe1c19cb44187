package io.b2mash.invoiceintake.storage.s3;

import io.b2mash.invoiceintake.config.S3Config.S3Properties;
import io.b2mash.invoiceintake.storage.OutputFile;
import io.b2mash.invoiceintake.storage.RemoteStorage;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CommonPrefix;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * S3 implementation of {@link RemoteStorage}. A "folder" is a key prefix {@code
 * <parent>/<folder>/}; uploads to the same prefix overwrite objects in place, which makes retried
 * uploads converge. Transient S3 errors are retried by the SDK's standard retry policy. All AWS SDK
 * types are confined to this class.
 */
@Component
@ConditionalOnProperty(name = "intake.storage.provider", havingValue = "s3", matchIfMissing = true)
public class S3RemoteStorageAdapter implements RemoteStorage {

  private static final Logger log = LoggerFactory.getLogger(S3RemoteStorageAdapter.class);

  /** A single path segment: no slashes, no leading dot, no control characters. */
  private static final Pattern SEGMENT_PATTERN =
      Pattern.compile("^[^/.\\p{Cntrl}][^/\\p{Cntrl}]*$");

  private final S3Client s3Client;
  private final String bucketName;

  public S3RemoteStorageAdapter(S3Client s3Client, S3Properties s3Properties) {
    this.s3Client = s3Client;
    this.bucketName = s3Properties.bucketName();
  }

  @Override
  public String uploadFolder(
      List<OutputFile> files, String destinationParentId, String folderName) {
    validateSegment(folderName);
    String prefix = parentPrefix(destinationParentId) + folderName + "/";

    for (OutputFile file : files) {
      validateSegment(file.name());
      var putRequest =
          PutObjectRequest.builder()
              .bucket(bucketName)
              .key(prefix + file.name())
              .contentType(file.contentType())
              .build();
      s3Client.putObject(putRequest, RequestBody.fromBytes(file.content()));
      log.debug("Uploaded s3://{}/{}{}", bucketName, prefix, file.name());
    }

    log.info("Uploaded {} file(s) to s3://{}/{}", files.size(), bucketName, prefix);
    return prefix;
  }

  @Override
  public List<String> listFolders(String destinationParentId) {
    String parent = parentPrefix(destinationParentId);
    var request =
        ListObjectsV2Request.builder().bucket(bucketName).prefix(parent).delimiter("/").build();

    var folders = new ArrayList<String>();
    for (CommonPrefix commonPrefix : s3Client.listObjectsV2Paginator(request).commonPrefixes()) {
      String name = commonPrefix.prefix().substring(parent.length());
      folders.add(name.endsWith("/") ? name.substring(0, name.length() - 1) : name);
    }
    return folders;
  }

  private static String parentPrefix(String destinationParentId) {
    if (destinationParentId == null || destinationParentId.isBlank()) {
      return "";
    }
    String trimmed = destinationParentId.strip();
    while (trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    return trimmed.isEmpty() ? "" : trimmed + "/";
  }

  private static void validateSegment(String segment) {
    if (segment == null || !SEGMENT_PATTERN.matcher(segment).matches()) {
      throw new IllegalArgumentException("Invalid storage name: " + segment);
    }
  }
}
