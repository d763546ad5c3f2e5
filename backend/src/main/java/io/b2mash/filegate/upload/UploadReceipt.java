package io.b2mash.filegate.upload;

import io.b2mash.filegate.file.FileRecord;
import io.b2mash.filegate.storageconfig.StorageConfig;

/** A committed file together with the links handed back to the uploader. */
public record UploadReceipt(
    FileRecord record, StorageConfig config, ShareLinks links, boolean usedOriginalFilename) {}
