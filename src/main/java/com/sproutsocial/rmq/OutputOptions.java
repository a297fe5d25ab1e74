package com.sproutsocial.rmq;

import com.sproutsocial.rmq.format.OutputFormat;

import java.io.File;

/**
 * How messages and the final result are rendered, and where messages go.
 * No output file means the console.
 */
public class OutputOptions {

    private OutputFormat format = OutputFormat.PLAIN;
    private File outputFile;
    private boolean compact = false;
    private boolean quiet = false;
    private boolean verbose = false;

    public boolean isConsole() {
        return outputFile == null;
    }

    //region accessors
    public OutputFormat getFormat() {
        return format;
    }

    public void setFormat(OutputFormat format) {
        this.format = format;
    }

    public File getOutputFile() {
        return outputFile;
    }

    public void setOutputFile(File outputFile) {
        this.outputFile = outputFile;
    }

    public boolean isCompact() {
        return compact;
    }

    public void setCompact(boolean compact) {
        this.compact = compact;
    }

    public boolean isQuiet() {
        return quiet;
    }

    public void setQuiet(boolean quiet) {
        this.quiet = quiet;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }
    //endregion

    @Override
    public String toString() {
        return "OutputOptions{" +
                "format=" + format +
                ", outputFile=" + outputFile +
                ", compact=" + compact +
                ", quiet=" + quiet +
                ", verbose=" + verbose +
                '}';
    }

}
