package com.ke.hal.controller;

import com.ke.hal.common.CommonPage;
import com.ke.hal.exception.BadRequestException;

import java.util.List;
import java.util.function.Function;

/**
 * 游标分页参数校验与结果组装，查询时多取一条用于判断 has_more
 */
class PageUtils {

    static final int MAX_LIMIT = 100;

    private PageUtils() {
    }

    static int checkLimit(int limit) {
        if(limit < 1 || limit > MAX_LIMIT) {
            throw new BadRequestException("limit must be between 1 and " + MAX_LIMIT);
        }
        return limit;
    }

    static String checkOrder(String order) {
        if(!"asc".equals(order) && !"desc".equals(order)) {
            throw new BadRequestException("order must be asc or desc");
        }
        return order;
    }

    static <T> CommonPage<T> toPage(List<T> infoList, int limit, Function<T, String> idGetter) {
        boolean hasMore = infoList.size() > limit;
        if(hasMore) {
            infoList.remove(infoList.size() - 1);
        }

        String firstId = infoList.isEmpty() ? null : idGetter.apply(infoList.get(0));
        String lastId = infoList.isEmpty() ? null : idGetter.apply(infoList.get(infoList.size() - 1));
        return new CommonPage<>(infoList, firstId, lastId, hasMore);
    }
}
