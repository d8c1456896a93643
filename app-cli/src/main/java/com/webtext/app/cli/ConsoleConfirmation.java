package com.webtext.app.cli;

import com.webtext.core.service.DirectoryConfirmation;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/** 콘솔에서 y/yes 입력을 받으면 생성 허용. 입력이 끊기면(EOF) 거절로 본다. */
public final class ConsoleConfirmation implements DirectoryConfirmation {

    private static final Set<String> CONFIRM = Set.of("y", "yes");

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleConfirmation(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, Charset.defaultCharset()));
        this.out = out;
    }

    @Override
    public boolean confirmCreate(Path dir) {
        out.println("Output path " + dir + " does not exist.");
        out.print("Would you like to make this directory? ");
        out.flush();
        try {
            String line = in.readLine();
            return line != null && CONFIRM.contains(line.trim().toLowerCase(Locale.ROOT));
        } catch (IOException e) {
            out.println();
            return false;
        }
    }
}
