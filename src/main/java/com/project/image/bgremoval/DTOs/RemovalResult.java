package com.project.image.bgremoval.DTOs;

public record RemovalResult(
        int width,
        int height,
        int threshold,
        int blurRadius,
        byte[] resultPng,           // transparent-background PNG, ready for download
        int backgroundPixels,
        double backgroundPercent
) {}
