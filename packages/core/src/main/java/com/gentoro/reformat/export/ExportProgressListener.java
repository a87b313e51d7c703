package com.gentoro.reformat.export;

/** Observer of export progress; called on the thread running the export. */
@FunctionalInterface
public interface ExportProgressListener {
  void onProgress(ExportProgress progress);
}
