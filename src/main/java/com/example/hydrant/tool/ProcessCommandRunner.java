package com.example.hydrant.tool;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class ProcessCommandRunner implements CommandRunner {

    @Override
    public CommandResult run(List<String> command, Duration timeout) {
        String tool = command.get(0);
        log.debug("exec$ {}", String.join(" ", command));

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(false);
        Process p = null;
        StringBuilder outSb = new StringBuilder();
        StringBuilder errSb = new StringBuilder();
        try {
            p = pb.start();
            Process finalP = p;
            Thread tOut = new Thread(() -> readAll(finalP.getInputStream(), outSb), tool + "-stdout");
            Thread tErr = new Thread(() -> readAll(finalP.getErrorStream(), errSb), tool + "-stderr");
            tOut.setDaemon(true);
            tErr.setDaemon(true);
            tOut.start();
            tErr.start();

            long deadline = System.nanoTime() + timeout.toNanos();
            boolean finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                p.destroyForcibly();
                throw new ExternalToolException(tool, "timed out after " + timeout);
            }
            // The pipes close on exit, so the readers finish once the buffered output is consumed
            joinWithin(tOut, deadline);
            joinWithin(tErr, deadline);
            if (tOut.isAlive() || tErr.isAlive()) {
                throw new ExternalToolException(tool, "output not fully read within " + timeout);
            }
            return new CommandResult(p.exitValue(), outSb.toString(), errSb.toString());
        } catch (IOException e) {
            throw new ExternalToolException(tool, "could not be started", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalToolException(tool, "interrupted", e);
        } finally {
            if (p != null && p.isAlive()) {
                p.destroyForcibly();
            }
        }
    }

    private static void joinWithin(Thread reader, long deadline) throws InterruptedException {
        // join(0) would wait forever, so never pass less than 1 ms
        long remainingMs = Math.max(1, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime()));
        reader.join(remainingMs);
    }

    private static void readAll(InputStream in, StringBuilder out) {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                synchronized (out) {
                    out.append(line).append('\n');
                }
            }
        } catch (IOException e) {
            log.debug("Stream closed while reading process output: {}", e.getMessage());
        }
    }
}
