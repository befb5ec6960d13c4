package com.gentoro.flowscript.query.result;

/** Result of an impact query; the concrete type follows the requested format. */
public interface WhatIfResult {}
