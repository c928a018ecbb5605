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

/**
 * a small dense matrix, just big enuff for the normal equations of a cutout or a calibration
 * fit.
 */
public class Matrix {
	/** the number of rows */
	public final int m;
	/** the number of collums */
	public final int n;
	/** the data */
	private final double[][] values;

	/**
	 * generate a new matrix by specifying all of its values explicitly.
	 */
	public Matrix(int m, int n, double[][] values) {
		this.m = m;
		if (values.length != m)
			throw new IllegalArgumentException("the height doesn’t match the data.");
		this.n = n;
		for (double[] row: values)
			if (row.length != n)
				throw new IllegalArgumentException("do not accept jagged arrays.");
		this.values = values;
	}

	/**
	 * generate a new matrix by giving a list of rows.
	 */
	public Matrix(double[][] values) {
		this(values.length, (values.length > 0) ? values[0].length : 0, values);
	}

	/**
	 * generate a zero matrix.
	 */
	public static Matrix zeros(int m, int n) {
		return new Matrix(m, n, new double[m][n]);
	}

	/**
	 * generate an identity matrix.
	 */
	public static Matrix identity(int n) {
		Matrix eye = zeros(n, n);
		for (int i = 0; i < n; i ++)
			eye.values[i][i] = 1;
		return eye;
	}

	public double[] matmul(double... v) {
		if (v.length != this.n)
			throw new IllegalArgumentException("the dimensions don't match.");
		double[] product = new double[this.m];
		for (int i = 0; i < this.m; i ++)
			product[i] = Math2.dot(this.values[i], v);
		return product;
	}

	public Matrix matmul(Matrix that) {
		if (this.n != that.m)
			throw new IllegalArgumentException("the matrix dimensions don't match");
		double[][] product = new double[this.m][that.n];
		for (int i = 0; i < this.m; i ++)
			for (int k = 0; k < this.n; k ++)
				if (this.values[i][k] != 0)
					for (int j = 0; j < that.n; j ++)
						product[i][j] += this.values[i][k]*that.values[k][j];
		return new Matrix(this.m, that.n, product);
	}

	/**
	 * the transpose of the matrix
	 */
	public Matrix trans() {
		double[][] transpose = new double[this.n][this.m];
		for (int i = 0; i < this.m; i ++)
			for (int j = 0; j < this.n; j ++)
				transpose[j][i] = this.values[i][j];
		return new Matrix(n, m, transpose);
	}

	/**
	 * compute Aᵀ W A, where A is this matrix and W is a diagonal matrix of weights.
	 * @param weights the diagonal of W, one per row of this
	 */
	public Matrix weighted_gram(double[] weights) {
		if (weights.length != this.m)
			throw new IllegalArgumentException("there must be one weight per row");
		double[][] gram = new double[this.n][this.n];
		for (int r = 0; r < this.m; r ++) {
			double[] row = this.values[r];
			for (int i = 0; i < this.n; i ++) {
				if (row[i] == 0)
					continue;
				double wa = weights[r]*row[i];
				for (int j = i; j < this.n; j ++)
					gram[i][j] += wa*row[j];
			}
		}
		for (int i = 0; i < this.n; i ++)
			for (int j = 0; j < i; j ++)
				gram[i][j] = gram[j][i];
		return new Matrix(n, n, gram);
	}

	/**
	 * compute Aᵀ W b, where A is this matrix and W is a diagonal matrix of weights.
	 */
	public double[] weighted_trans_times(double[] weights, double[] b) {
		if (weights.length != this.m || b.length != this.m)
			throw new IllegalArgumentException("there must be one weight and one value per row");
		double[] product = new double[this.n];
		for (int r = 0; r < this.m; r ++)
			for (int j = 0; j < this.n; j ++)
				product[j] += this.values[r][j]*weights[r]*b[r];
		return product;
	}

	/**
	 * solve the square linear system this*x = b by Gaussian elimination with scaled partial
	 * pivoting.
	 * @throws SingularMatrixException if a pivot vanishes
	 */
	public double[] solve(double[] b) {
		if (this.m != this.n)
			throw new IllegalArgumentException("Only square systems can be solved this way; not this "+m+"×"+n+" one.");
		if (b.length != this.m)
			throw new IllegalArgumentException("the array sizes do not match");
		double[][] a = Math2.deepCopy(this.values);
		int[] index = new int[n];

		// Transform the matrix into an upper triangle
		gaussian(a, index);

		// Apply the recorded row operations to b
		double[] y = new double[n];
		for (int i = 0; i < n; i ++) {
			y[i] = b[index[i]];
			for (int j = 0; j < i; j ++)
				y[i] -= a[index[i]][j]*y[j];
		}

		// Perform backward substitution
		double[] x = new double[n];
		for (int i = n - 1; i >= 0; i --) {
			double pivot = a[index[i]][i];
			if (pivot == 0 || !Double.isFinite(pivot))
				throw new SingularMatrixException(i);
			x[i] = y[i];
			for (int k = i + 1; k < n; k ++)
				x[i] -= a[index[i]][k]*x[k];
			x[i] /= pivot;
		}
		return x;
	}

	/**
	 * invert this matrix, assuming it is symmetric positive definite, using a Cholesky
	 * decomposition.  each pivot is checked against the corresponding diagonal element; if it
	 * has shrunk by more than the given relative tolerance, the matrix is considerd singular.
	 * @param tolerance the smallest acceptable ratio of a Cholesky pivot to its diagonal element
	 * @throws SingularMatrixException if the matrix is not safely positive definite
	 */
	public Matrix cholesky_inverse(double tolerance) {
		if (this.m != this.n)
			throw new IllegalArgumentException("this makes no sense for a " + this.m + "×" + this.n);
		double[][] L = new double[n][n];
		for (int j = 0; j < n; j ++) {
			double diagonal = this.values[j][j];
			double pivot = diagonal;
			for (int k = 0; k < j; k ++)
				pivot -= L[j][k]*L[j][k];
			if (!(diagonal > 0) || !(pivot > tolerance*diagonal) || !Double.isFinite(pivot))
				throw new SingularMatrixException(j);
			L[j][j] = Math.sqrt(pivot);
			for (int i = j + 1; i < n; i ++) {
				double s = this.values[i][j];
				for (int k = 0; k < j; k ++)
					s -= L[i][k]*L[j][k];
				L[i][j] = s/L[j][j];
			}
		}

		// invert the lower triangle
		double[][] L_inv = new double[n][n];
		for (int i = 0; i < n; i ++) {
			L_inv[i][i] = 1/L[i][i];
			for (int j = 0; j < i; j ++) {
				double s = 0;
				for (int k = j; k < i; k ++)
					s -= L[i][k]*L_inv[k][j];
				L_inv[i][j] = s/L[i][i];
			}
		}

		// and then A^-1 = L^-T L^-1
		double[][] inverse = new double[n][n];
		for (int i = 0; i < n; i ++) {
			for (int j = 0; j <= i; j ++) {
				double s = 0;
				for (int k = i; k < n; k ++)
					s += L_inv[k][i]*L_inv[k][j];
				inverse[i][j] = s;
				inverse[j][i] = s;
			}
		}
		return new Matrix(n, n, inverse);
	}

	/**
	 * Method to carry out the partial-pivoting Gaussian
	 * elimination. Here index[] stores pivoting order.
	 */
	private static void gaussian(double[][] a, int[] index) {
		int n = index.length;
		double[] c = new double[n];

		// Initialize the index
		for (int i = 0; i < n; ++i)
			index[i] = i;

		// Find the rescaling factors, one from each row
		for (int i = 0; i < n; ++i) {
			double c1 = 0;
			for (int j = 0; j < n; ++j)
				c1 = Math.max(c1, Math.abs(a[i][j]));
			if (c1 == 0)
				throw new SingularMatrixException(i);
			c[i] = c1;
		}

		// Search the pivoting element from each column
		for (int j = 0; j < n - 1; ++j) {
			double pi1 = 0;
			int k = j;
			for (int i = j; i < n; ++i) {
				double pi0 = Math.abs(a[index[i]][j])/c[index[i]];
				if (pi0 > pi1) {
					pi1 = pi0;
					k = i;
				}
			}
			if (pi1 == 0)
				throw new SingularMatrixException(j);

			// Interchange rows according to the pivoting order
			int itmp = index[j];
			index[j] = index[k];
			index[k] = itmp;
			for (int i = j + 1; i < n; ++i) {
				double pj = a[index[i]][j] / a[index[j]][j];

				// Record pivoting ratios below the diagonal
				a[index[i]][j] = pj;

				// Modify other elements accordingly
				for (int l = j + 1; l < n; ++l)
					a[index[i]][l] -= pj * a[index[j]][l];
			}
		}
	}

	public double get(int i, int j) {
		return this.values[i][j];
	}

	public double[] getRow(int i) {
		return this.values[i].clone();
	}

	public double[] getDiagonal() {
		double[] diagonal = new double[Math.min(m, n)];
		for (int i = 0; i < diagonal.length; i ++)
			diagonal[i] = this.values[i][i];
		return diagonal;
	}

	public double[][] getValues() {
		return Math2.deepCopy(this.values);
	}

	@Override
	public String toString() {
		if (this.m*this.n < 1000) {
			StringBuilder s = new StringBuilder(String.format("Matrix %d×%d [\n  ", m, n));
			for (int i = 0; i < this.m; i++) {
				for (int j = 0; j < this.n; j++) {
					s.append(String.format("%8.4g", this.get(i, j)));
					s.append("  ");
				}
				s.append("\n  ");
			}
			return s.append("]").toString();
		}
		else {
			return String.format("Matrix %d×%d [ … ]", m, n);
		}
	}

	/**
	 * thrown when a matrix turns out to be singular, or close enuff to it.
	 */
	public static class SingularMatrixException extends ArithmeticException {
		/** the row/collum at which the decomposition broke down */
		public final int index;

		public SingularMatrixException(int index) {
			super("the matrix is singular at row " + index);
			this.index = index;
		}
	}
}
