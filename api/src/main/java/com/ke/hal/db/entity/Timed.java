package com.ke.hal.db.entity;

/**
 * 时间审计接口 用于标识包含创建时间和更新时间的实体，单位为秒
 */
public interface Timed {

    Long getCreatedAt();

    void setCreatedAt(Long createdAt);

    Long getUpdatedAt();

    void setUpdatedAt(Long updatedAt);
}
