package com.webtext.core.util;

import com.webtext.core.model.ItemResult;

@FunctionalInterface
public interface ProgressListener {
    /**
     * 입력 한 줄 처리가 끝날 때마다 호출.
     *
     * @param done  처리한 줄 수
     * @param total 전체 줄 수
     * @param item  방금 처리한 항목 결과(건너뛴 줄이면 null)
     */
    void onProgress(int done, int total, ItemResult item);

    ProgressListener NONE = (d, t, i) -> {};
}
