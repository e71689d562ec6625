package com.example.est.tomography;

public class ImageRotator {

    public double[][] rotate(double[][] image, double angleDegrees) {
        int height = image.length;
        int width = height == 0 ? 0 : image[0].length;
        double[][] rotated = new double[height][width];
        if (height == 0 || width == 0) {
            return rotated;
        }

        double theta = Math.toRadians(angleDegrees);
        double cos = Math.cos(theta);
        double sin = Math.sin(theta);
        double cy = (height - 1) / 2.0;
        double cx = (width - 1) / 2.0;

        for (int row = 0; row < height; row++) {
            double dy = row - cy;
            for (int col = 0; col < width; col++) {
                double dx = col - cx;
                // mapeamento inverso: pixel de saída -> coordenada na origem
                double sx = cos * dx + sin * dy + cx;
                double sy = -sin * dx + cos * dy + cy;
                rotated[row][col] = bilinear(image, sy, sx, height, width);
            }
        }
        return rotated;
    }

    private static double bilinear(double[][] image, double y, double x, int height, int width) {
        if (y <= -1 || x <= -1 || y >= height || x >= width) {
            return 0;
        }
        int y0 = (int) Math.floor(y);
        int x0 = (int) Math.floor(x);
        double fy = y - y0;
        double fx = x - x0;

        double top = (1 - fx) * sample(image, y0, x0, height, width)
                + fx * sample(image, y0, x0 + 1, height, width);
        double bottom = (1 - fx) * sample(image, y0 + 1, x0, height, width)
                + fx * sample(image, y0 + 1, x0 + 1, height, width);
        return (1 - fy) * top + fy * bottom;
    }

    private static double sample(double[][] image, int y, int x, int height, int width) {
        if (y < 0 || x < 0 || y >= height || x >= width) {
            return 0;
        }
        return image[y][x];
    }
}
