package com.sproutsocial.rmq;

import com.sproutsocial.rmq.format.MessageFormatter;
import com.sproutsocial.rmq.format.TextMessageFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Writes messages to a file, or to numbered files of at most messagesPerFile messages each when rotating.
 * Rotated files are named {@code base.N.ext} with N counting from 0. Any write failure is fatal.
 */
public class FileOutput extends MessageOutput {

    private final File outputFile;
    private final boolean rotate;
    private final int messagesPerFile;
    private final String delimiter;
    private final List<File> files = new ArrayList<File>();

    private Writer writer;
    private int messagesInFile = 0;

    private static final Logger logger = LoggerFactory.getLogger(FileOutput.class);

    public FileOutput(MessageFormatter formatter, boolean compact, File outputFile, FileConfig fileConfig, boolean rotate) {
        super(formatter, compact);
        this.outputFile = checkNotNull(outputFile);
        this.rotate = rotate;
        this.messagesPerFile = fileConfig.getMessagesPerFile();
        checkArgument(!rotate || messagesPerFile > 0, "messagesPerFile must be greater than zero");
        //only plain text is separated, a delimiter without a line break gets a line of its own
        this.delimiter = formatter instanceof TextMessageFormatter ? fileConfig.getMessageDelimiter() : null;
    }

    /**
     * Rotate when the number of messages is unknown or more than one file holds.
     */
    public static boolean shouldRotate(long messageCount, int messagesPerFile) {
        return messageCount <= 0 || messageCount > messagesPerFile;
    }

    @Override
    protected void writeMessage(RetrievedMessage message) throws IOException {
        String text = formatter.format(message, compact);
        if (writer == null || (rotate && messagesInFile >= messagesPerFile)) {
            openNextFile();
        }
        else if (delimiter != null) {
            writer.write(delimiter);
            if (!delimiter.contains(System.lineSeparator())) {
                writer.write(System.lineSeparator());
            }
        }
        writer.write(text);
        writer.write(System.lineSeparator());
        writer.flush();
        messagesInFile++;
    }

    private void openNextFile() throws IOException {
        closeWriter();
        File file = rotate ? rotatedFile(outputFile, files.size()) : outputFile;
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null) {
            Files.createDirectories(parent.toPath());
        }
        writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8);
        files.add(file);
        messagesInFile = 0;
        logger.debug("writing messages to {}", file);
    }

    static File rotatedFile(File base, int index) {
        String name = base.getName();
        int dot = name.lastIndexOf('.');
        String rotated = dot > 0
                ? name.substring(0, dot) + "." + index + name.substring(dot)
                : name + "." + index;
        return new File(base.getParentFile(), rotated);
    }

    private void closeWriter() throws IOException {
        if (writer != null) {
            Writer w = writer;
            writer = null;
            w.close();
        }
    }

    @Override
    public void close() throws IOException {
        closeWriter();
    }

    @Override
    protected boolean isFailureFatal() {
        return true;
    }

    @Override
    public String getDestination() {
        return outputFile.getPath();
    }

    /**
     * @return the files written so far, in order
     */
    public List<File> getFiles() {
        return Collections.unmodifiableList(files);
    }

    public boolean isRotating() {
        return rotate;
    }

}
