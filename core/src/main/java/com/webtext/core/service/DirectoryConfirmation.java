package com.webtext.core.service;

import java.nio.file.Path;

/** 없는 출력 디렉터리를 만들어도 되는지 묻는 콜백. CLI는 콘솔 프롬프트, 테스트는 람다. */
@FunctionalInterface
public interface DirectoryConfirmation {

    boolean confirmCreate(Path dir);

    DirectoryConfirmation ALWAYS = dir -> true;
    DirectoryConfirmation NEVER = dir -> false;
}
