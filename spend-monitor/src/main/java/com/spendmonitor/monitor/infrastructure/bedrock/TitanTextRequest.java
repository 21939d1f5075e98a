package com.spendmonitor.monitor.infrastructure.bedrock;

record TitanTextRequest(String inputText, TextGenerationConfig textGenerationConfig) {

    record TextGenerationConfig(int maxTokenCount, double temperature, double topP) {}
}
