package org.janelia.colortransport.ot;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class AssignmentSolverTest {

    private static PixelSet randomPixels(int n, long seed) {
        Random random = new Random(seed);
        double[][] colors = new double[n][];
        for (int i = 0; i < n; i++) {
            colors[i] = new double[]{random.nextInt(256), random.nextInt(256), random.nextInt(256)};
        }
        return PixelSet.of(colors);
    }

    private static void checkInjective(Assignment assignment) {
        Set<Integer> usedSources = new HashSet<>();
        Set<Integer> usedTargets = new HashSet<>();
        for (int k = 0; k < assignment.size(); k++) {
            assertTrue(usedSources.add(assignment.getSourceIndex(k)));
            assertTrue(usedTargets.add(assignment.getTargetIndex(k)));
        }
    }

    private static double bruteForceMinCost(CostMatrix costMatrix, int row, boolean[] usedCols) {
        int n = costMatrix.getRows();
        if (row == n) {
            return 0;
        }
        double best = Double.POSITIVE_INFINITY;
        for (int col = 0; col < n; col++) {
            if (!usedCols[col]) {
                usedCols[col] = true;
                best = Math.min(best, costMatrix.get(row, col) + bruteForceMinCost(costMatrix, row + 1, usedCols));
                usedCols[col] = false;
            }
        }
        return best;
    }

    @Test
    public void findsOptimalMatching() {
        for (long seed = 1; seed <= 5; seed++) {
            PixelSet source = randomPixels(6, seed);
            PixelSet target = randomPixels(6, seed + 100);

            Assignment assignment = new AssignmentSolver().solve(source, target);

            assertEquals(6, assignment.size());
            assertFalse(assignment.isSubsampled());
            checkInjective(assignment);
            CostMatrix costMatrix = CostModel.euclideanCost(source, target);
            assertEquals(bruteForceMinCost(costMatrix, 0, new boolean[6]), assignment.getTotalCost(), 1e-9);
        }
    }

    @Test
    public void recoversPermutation() {
        PixelSet source = PixelSet.of(
                new double[]{255, 0, 0},
                new double[]{0, 255, 0},
                new double[]{0, 0, 255},
                new double[]{128, 128, 128});
        PixelSet target = PixelSet.of(
                new double[]{120, 130, 125},
                new double[]{0, 0, 250},
                new double[]{250, 5, 0},
                new double[]{3, 250, 3});

        Assignment assignment = new AssignmentSolver().solve(source, target);

        int[] expectedTargets = new int[]{2, 3, 1, 0};
        for (int k = 0; k < assignment.size(); k++) {
            assertEquals(expectedTargets[assignment.getSourceIndex(k)], assignment.getTargetIndex(k));
        }
    }

    @Test
    public void costIsNotWorseThanIdentityPairing() {
        PixelSet source = randomPixels(40, 7);
        PixelSet target = randomPixels(40, 8);
        CostMatrix costMatrix = CostModel.euclideanCost(source, target);
        double identityCost = 0;
        for (int i = 0; i < 40; i++) {
            identityCost += costMatrix.get(i, i);
        }

        Assignment assignment = new AssignmentSolver().solve(source, target);

        checkInjective(assignment);
        assertTrue(assignment.getTotalCost() <= identityCost + 1e-9);
    }

    @Test
    public void subsamplesLargeSets() {
        PixelSet source = randomPixels(50, 3);
        PixelSet target = randomPixels(20, 4);

        Assignment assignment = new AssignmentSolver(10).solve(source, target);

        assertEquals(10, assignment.size());
        assertTrue(assignment.isSubsampled());
        checkInjective(assignment);
        Set<Integer> sampledSources = new HashSet<>();
        for (int i : AssignmentSolver.evenlySpacedIndices(50, 10)) {
            sampledSources.add(i);
        }
        Set<Integer> sampledTargets = new HashSet<>();
        for (int i : AssignmentSolver.evenlySpacedIndices(20, 10)) {
            sampledTargets.add(i);
        }
        for (int k = 0; k < assignment.size(); k++) {
            assertTrue(sampledSources.contains(assignment.getSourceIndex(k)));
            assertTrue(sampledTargets.contains(assignment.getTargetIndex(k)));
        }
    }

    @Test
    public void unequalSetsUseTheSmallerSize() {
        Assignment assignment = new AssignmentSolver().solve(randomPixels(12, 1), randomPixels(5, 2));

        assertEquals(5, assignment.size());
        assertTrue(assignment.isSubsampled());
        checkInjective(assignment);
    }

    @Test
    public void evenlySpacedIndices() {
        assertArrayEquals(new int[]{0, 2, 4, 6, 9}, AssignmentSolver.evenlySpacedIndices(10, 5));
        assertArrayEquals(new int[]{0, 1, 2}, AssignmentSolver.evenlySpacedIndices(3, 3));
        assertArrayEquals(new int[]{0}, AssignmentSolver.evenlySpacedIndices(7, 1));
        assertArrayEquals(new int[]{0, 99}, AssignmentSolver.evenlySpacedIndices(100, 2));
    }

    @Test(expected = InvalidTransportInputException.class)
    public void sampleSizeMustBePositive() {
        new AssignmentSolver(0);
    }
}
