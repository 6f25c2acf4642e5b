package com.newsverdict.service.scoring;

public interface FabricationModel {
    double probabilityFake(String cleanedText);
}
