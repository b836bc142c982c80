package com.image.optimization.api;

import java.nio.file.Path;

/**
 * One image to optimize: where it is read from and where the optimized copy goes.
 *
 * @param sourcePath      the input file
 * @param destinationPath the output file
 */
public record WorkItem(Path sourcePath, Path destinationPath) {

    public WorkItem {
        if (sourcePath == null) {
            throw new IllegalArgumentException("sourcePath must not be null");
        }
        if (destinationPath == null) {
            throw new IllegalArgumentException("destinationPath must not be null");
        }
    }

    public static WorkItem of(String sourcePath, String destinationPath) {
        return new WorkItem(Path.of(sourcePath), Path.of(destinationPath));
    }

    /**
     * Returns the file name of the source, used to label results and progress.
     */
    public String fileName() {
        Path name = sourcePath.getFileName();
        return name != null ? name.toString() : sourcePath.toString();
    }
}
