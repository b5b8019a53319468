package me.golemcore.fleet.protocol;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Redirects the standard streams of the process to the files named in an
 * invocation for the duration of an action.
 *
 * <p>
 * {@link #close()} flushes and closes both files, restores the original
 * streams and only then writes the exit status, so that a reader seeing the
 * exit status file always finds complete output. The exit status is written
 * through a temporary file and an atomic rename.
 */
@Slf4j
public final class OutputRedirection implements AutoCloseable {

    private final OutputFiles files;
    private final PrintStream originalOut;
    private final PrintStream originalErr;
    private final PrintStream out;
    private final PrintStream err;
    private int exitCode = 1;
    private boolean closed;

    private OutputRedirection(OutputFiles files, PrintStream out, PrintStream err) {
        this.files = files;
        this.originalOut = System.out;
        this.originalErr = System.err;
        this.out = out;
        this.err = err;
        System.setOut(out);
        System.setErr(err);
    }

    /**
     * Opens the output files and installs them as standard streams.
     *
     * @throws IOException
     *             if a path is missing or either file cannot be opened
     */
    public static OutputRedirection open(OutputFiles files) throws IOException {
        if (!files.isComplete()) {
            throw new IOException("incomplete output files " + files);
        }
        PrintStream out = new PrintStream(new FileOutputStream(files.stdout()), true, StandardCharsets.UTF_8);
        PrintStream err;
        try {
            err = new PrintStream(new FileOutputStream(files.stderr()), true, StandardCharsets.UTF_8);
        } catch (IOException e) {
            out.close();
            throw e;
        }
        return new OutputRedirection(files, out, err);
    }

    public PrintStream out() {
        return out;
    }

    /**
     * Sets the exit status recorded on close. Defaults to 1, so that an action
     * aborted by an unexpected fault is recorded as failed.
     */
    public void setExitCode(int exitCode) {
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;

        out.flush();
        err.flush();
        out.close();
        err.close();
        System.setOut(originalOut);
        System.setErr(originalErr);
        if (out.checkError() || err.checkError()) {
            log.warn("Errors occurred while writing the redirected output");
        }

        writeExitCode(files.exitcodePath(), exitCode);
    }

    static void writeExitCode(Path exitcodeFile, int exitCode) throws IOException {
        Path tmp = exitcodeFile.resolveSibling(exitcodeFile.getFileName() + ".tmp");
        Files.writeString(tmp, Integer.toString(exitCode) + "\n", StandardCharsets.UTF_8);
        try {
            Files.move(tmp, exitcodeFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, exitcodeFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
