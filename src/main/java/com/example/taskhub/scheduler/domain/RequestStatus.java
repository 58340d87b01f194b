package com.example.taskhub.scheduler.domain;

public enum RequestStatus {
    READY,   // 可领取（not_before 到期后）
    CLAIMED, // 已被某个 worker 领取，靠 heartbeat 续租
    DONE     // 已处理（ack）
}
