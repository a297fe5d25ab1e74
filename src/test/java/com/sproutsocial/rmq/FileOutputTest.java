package com.sproutsocial.rmq;

import com.sproutsocial.rmq.format.JsonMessageFormatter;
import com.sproutsocial.rmq.format.MessageFormatter;
import com.sproutsocial.rmq.format.OutputFormat;
import com.sproutsocial.rmq.format.TextMessageFormatter;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import static com.sproutsocial.rmq.MessageFixtures.drain;
import static com.sproutsocial.rmq.MessageFixtures.receiveQueue;
import static org.junit.Assert.*;

public class FileOutputTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static int countLines(File file) throws Exception {
        return Files.readAllLines(file.toPath(), StandardCharsets.UTF_8).size();
    }

    @Test
    public void testRotationBoundary() throws Exception {
        int perFile = 4;
        FileConfig fileConfig = new FileConfig();
        fileConfig.setMessagesPerFile(perFile);
        File base = new File(folder.getRoot(), "messages.json");
        long messageCount = 2 * perFile + 1;
        assertTrue(FileOutput.shouldRotate(messageCount, perFile));
        FileOutput output = new FileOutput(new JsonMessageFormatter(), false, base, fileConfig, true);
        HandoffQueue<AckIntent> ackQueue = new HandoffQueue<AckIntent>("ack");

        MessageOutputResult result = output.writeMessages(receiveQueue((int) messageCount), ackQueue, AckMode.ACK,
                new CancellationSignal("user"), new CancellationSignal("abort"));

        assertEquals(messageCount, result.getProcessedCount());
        List<File> files = output.getFiles();
        assertEquals(3, files.size());
        assertEquals("messages.0.json", files.get(0).getName());
        assertEquals("messages.1.json", files.get(1).getName());
        assertEquals("messages.2.json", files.get(2).getName());
        assertEquals(perFile, countLines(files.get(0)));
        assertEquals(perFile, countLines(files.get(1)));
        assertEquals(1, countLines(files.get(2)));
        assertFalse(base.exists());
        assertEquals(messageCount, drain(ackQueue).size());
    }

    @Test
    public void testSingleFileWhenCountFits() throws Exception {
        FileConfig fileConfig = new FileConfig();
        fileConfig.setMessagesPerFile(10);
        File base = new File(folder.getRoot(), "out/messages.txt");
        OutputOptions options = new OutputOptions();
        options.setOutputFile(base);
        options.setFormat(OutputFormat.PLAIN);
        MessageOutput output = MessageOutput.create(options, fileConfig, 10);
        assertTrue(output instanceof FileOutput);
        assertFalse(((FileOutput) output).isRotating());

        output.writeMessages(receiveQueue(3), new HandoffQueue<AckIntent>("ack"), AckMode.ACK,
                new CancellationSignal("user"), new CancellationSignal("abort"));

        assertTrue(base.exists());
        String text = new String(Files.readAllBytes(base.toPath()), StandardCharsets.UTF_8);
        assertTrue(text.startsWith("== Message #1 =="));
        assertTrue(text.contains(System.lineSeparator() + System.lineSeparator() + "== Message #2 =="));
    }

    private static List<String> readLines(File file) throws Exception {
        return Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
    }

    @Test
    public void testDelimiterOnItsOwnLine() throws Exception {
        FileConfig fileConfig = new FileConfig();
        fileConfig.setMessageDelimiter("-----");
        File base = new File(folder.getRoot(), "messages.txt");
        FileOutput output = new FileOutput(new TextMessageFormatter(), false, base, fileConfig, false);

        output.writeMessages(receiveQueue(2), new HandoffQueue<AckIntent>("ack"), AckMode.ACK,
                new CancellationSignal("user"), new CancellationSignal("abort"));

        List<String> lines = readLines(base);
        int delimiterLine = lines.indexOf("-----");
        assertTrue(delimiterLine > 0);
        assertEquals(delimiterLine, lines.lastIndexOf("-----"));
        assertEquals("== Message #2 ==", lines.get(delimiterLine + 1));
        assertEquals("== Message #1 ==", lines.get(0));
    }

    @Test
    public void testDelimiterOnlyWithinRotatedFile() throws Exception {
        FileConfig fileConfig = new FileConfig();
        fileConfig.setMessageDelimiter("-----");
        fileConfig.setMessagesPerFile(2);
        File base = new File(folder.getRoot(), "messages.txt");
        FileOutput output = new FileOutput(new TextMessageFormatter(), false, base, fileConfig, true);

        output.writeMessages(receiveQueue(3), new HandoffQueue<AckIntent>("ack"), AckMode.ACK,
                new CancellationSignal("user"), new CancellationSignal("abort"));

        assertEquals(2, output.getFiles().size());
        List<String> first = readLines(output.getFiles().get(0));
        int delimiterLine = first.indexOf("-----");
        assertTrue(delimiterLine > 0);
        assertEquals("== Message #2 ==", first.get(delimiterLine + 1));
        List<String> second = readLines(output.getFiles().get(1));
        assertEquals("== Message #3 ==", second.get(0));
        assertFalse(second.contains("-----"));
    }

    @Test
    public void testUnlimitedCountRotates() {
        assertTrue(FileOutput.shouldRotate(0, 10000));
        assertTrue(FileOutput.shouldRotate(-1, 10000));
        assertTrue(FileOutput.shouldRotate(10001, 10000));
        assertFalse(FileOutput.shouldRotate(10000, 10000));
        assertEquals("dump.3", FileOutput.rotatedFile(new File("dump"), 3).getName());
        assertEquals("a.b.7.txt", FileOutput.rotatedFile(new File("a.b.txt"), 7).getName());
    }

    @Test
    public void testFailureIsFatal() throws Exception {
        MessageFormatter formatter = new TextMessageFormatter() {
            @Override
            public String format(RetrievedMessage message, boolean compact) {
                if (message.getDeliveryTag() == 2) {
                    throw new IllegalStateException("disk full");
                }
                return super.format(message, compact);
            }
        };
        FileOutput output = new FileOutput(formatter, true, new File(folder.getRoot(), "m.txt"), new FileConfig(), false);
        HandoffQueue<AckIntent> ackQueue = new HandoffQueue<AckIntent>("ack");
        CancellationSignal abort = new CancellationSignal("abort");

        MessageOutputResult result = output.writeMessages(receiveQueue(4), ackQueue, AckMode.ACK,
                new CancellationSignal("user"), abort);

        assertTrue(result.isFailed());
        assertTrue(abort.isCancelled());
        assertEquals(1, result.getProcessedCount());
        assertEquals(3, result.getSkippedCount());
        List<AckIntent> intents = drain(ackQueue);
        assertEquals(new AckIntent(1, AckMode.ACK), intents.get(0));
        for (int i = 1; i < 4; i++) {
            assertEquals(AckMode.REQUEUE, intents.get(i).getOutcome());
        }
    }

}
