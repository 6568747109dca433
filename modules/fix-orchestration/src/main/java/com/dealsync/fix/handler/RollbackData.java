package com.dealsync.fix.handler;

/** State captured when a fix is applied, sufficient to reverse that fix later. */
public interface RollbackData {}
