/**
 * Pre-flight validation of optimization tasks.
 */
package com.phillippitts.imageoptimizer.service.validation;
