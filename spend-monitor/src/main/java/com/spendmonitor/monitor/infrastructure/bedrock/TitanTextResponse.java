package com.spendmonitor.monitor.infrastructure.bedrock;

import java.util.List;

record TitanTextResponse(Integer inputTextTokenCount, List<Result> results) {

    record Result(Integer tokenCount, String outputText, String completionReason) {}
}
