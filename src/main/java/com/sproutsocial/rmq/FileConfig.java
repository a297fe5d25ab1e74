package com.sproutsocial.rmq;

/**
 * File output settings.
 */
public class FileConfig {

    public static final int DEFAULT_MESSAGES_PER_FILE = 10000;

    private int messagesPerFile = DEFAULT_MESSAGES_PER_FILE;
    private String messageDelimiter = System.lineSeparator();

    //region accessors
    public int getMessagesPerFile() {
        return messagesPerFile;
    }

    public void setMessagesPerFile(int messagesPerFile) {
        this.messagesPerFile = messagesPerFile;
    }

    public String getMessageDelimiter() {
        return messageDelimiter;
    }

    public void setMessageDelimiter(String messageDelimiter) {
        this.messageDelimiter = messageDelimiter;
    }
    //endregion

    @Override
    public String toString() {
        return "FileConfig{" +
                "messagesPerFile=" + messagesPerFile +
                '}';
    }

}
