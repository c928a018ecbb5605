/*
 * MIT License
 *
 * Copyright (c) 2022 Justin Kunimune
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package ifs;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MatrixTest {

	@Test
	void solve() {
		Matrix A = new Matrix(new double[][] {
				{2, 1, -1},
				{-3, -1, 2},
				{-2, 1, 2}});
		assertArrayEquals(new double[] {2, 3, -1}, A.solve(new double[] {8, -11, -3}), 1e-12);
	}

	@Test
	void solveNeedsPivoting() {
		Matrix A = new Matrix(new double[][] {
				{0, 1},
				{1, 0}});
		assertArrayEquals(new double[] {5, 4}, A.solve(new double[] {4, 5}), 1e-12);
	}

	@Test
	void solveRejectsSingularMatrices() {
		Matrix A = new Matrix(new double[][] {
				{1, 2},
				{2, 4}});
		assertThrows(Matrix.SingularMatrixException.class, () -> A.solve(new double[] {1, 2}));
		assertThrows(IllegalArgumentException.class, () -> Matrix.zeros(2, 3).solve(new double[2]));
	}

	@Test
	void choleskyInverse() {
		Matrix A = new Matrix(new double[][] {
				{4, 2, 0.4},
				{2, 5, 1},
				{0.4, 1, 3}});
		Matrix product = A.matmul(A.cholesky_inverse(1e-10));
		for (int i = 0; i < 3; i ++)
			assertArrayEquals(Matrix.identity(3).getRow(i), product.getRow(i), 1e-12);
	}

	@Test
	void choleskyFindsTheDegenerateCollum() {
		Matrix A = new Matrix(new double[][] {
				{1, 0, 0},
				{0, 2, 2},
				{0, 2, 2}});
		Matrix.SingularMatrixException e = assertThrows(
				Matrix.SingularMatrixException.class, () -> A.cholesky_inverse(1e-10));
		assertEquals(2, e.index);
	}

	@Test
	void weightedGramMatchesTheLongWay() {
		Matrix A = new Matrix(new double[][] {
				{1, 2},
				{0, 3},
				{4, 0},
				{1, 1}});
		double[] w = {1, 0.5, 2, 3};
		double[] b = {1, 2, 3, 4};
		double[][] WA = A.getValues();
		for (int i = 0; i < WA.length; i ++)
			for (int j = 0; j < WA[i].length; j ++)
				WA[i][j] *= w[i];
		Matrix expected = A.trans().matmul(new Matrix(WA));
		Matrix gram = A.weighted_gram(w);
		for (int i = 0; i < 2; i ++)
			assertArrayEquals(expected.getRow(i), gram.getRow(i), 1e-12);
		assertArrayEquals(new Matrix(WA).trans().matmul(b), A.weighted_trans_times(w, b), 1e-12);
		assertArrayEquals(new double[] {expected.get(0, 0), expected.get(1, 1)}, gram.getDiagonal(), 1e-12);
	}

	@Test
	void rejectsJaggedArrays() {
		assertThrows(IllegalArgumentException.class, () -> new Matrix(new double[][] {{1, 2}, {3}}));
	}
}
