/* Plugbar © 2025 Plugbar Devs — MIT */
@MenuGroup("Analysis")
package dev.plugbar.testplugins.analysis;

import dev.plugbar.api.MenuGroup;
